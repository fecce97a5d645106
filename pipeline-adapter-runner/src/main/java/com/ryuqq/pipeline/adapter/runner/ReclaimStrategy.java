package com.ryuqq.pipeline.adapter.runner;

/**
 * Stale 잠금 처리 전략.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ReclaimStrategy {

    /**
     * 회수 전략.
     *
     * <p>takeover guard를 잡고 staleness를 재확인한 뒤 잠금 파일을 삭제합니다.
     * 다음 획득 시도는 경합 없이 성공합니다.</p>
     */
    RECLAIM,

    /**
     * 보고 전략.
     *
     * <p>잠금 파일은 그대로 두고 WARN 로그만 남깁니다. 회수는 다음 획득 시도의 takeover에 맡깁니다.</p>
     */
    REPORT
}
