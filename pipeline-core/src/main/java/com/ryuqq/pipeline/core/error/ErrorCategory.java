package com.ryuqq.pipeline.core.error;

/**
 * 오류 분류 (재시도 가능 여부 판단 기준).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 일시적 오류 (잠금 경합, 파일시스템 경합, 타임아웃). 백오프 후 재시도.
     */
    TRANSIENT,

    /**
     * 외부에서 조치 가능한 오류. 복구 작업 수행 후 재시도.
     */
    RECOVERABLE,

    /**
     * 치명적 오류. 재시도하지 않고 즉시 전파.
     */
    FATAL;

    public boolean isRetryable() {
        return this != FATAL;
    }
}
