package com.ryuqq.pipeline.adapter.runner;

/**
 * RECOVERABLE 실패를 해소하는 보정 작업.
 *
 * <p>보정이 끝나면 원래 작업을 다시 시도합니다. 보정 자체가 실패하면 재시도를 중단합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Remediation {

    /**
     * @param failure 보정 대상 실패
     */
    void remediate(RuntimeException failure);
}
