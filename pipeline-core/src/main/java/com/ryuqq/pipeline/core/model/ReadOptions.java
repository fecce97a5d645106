package com.ryuqq.pipeline.core.model;

/**
 * Section 읽기 옵션.
 *
 * @param allowMissing 프로젝트나 Section이 없을 때 예외 대신 빈 결과 반환
 * @param includeHistory 이력 포함 여부
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ReadOptions(boolean allowMissing, boolean includeHistory) {

    private static final ReadOptions DEFAULTS = new ReadOptions(false, false);

    /**
     * 기본 옵션 (없으면 NotFound, 이력 제외).
     */
    public static ReadOptions defaults() {
        return DEFAULTS;
    }

    public ReadOptions withAllowMissing(boolean allowMissing) {
        return new ReadOptions(allowMissing, includeHistory);
    }

    public ReadOptions withIncludeHistory(boolean includeHistory) {
        return new ReadOptions(allowMissing, includeHistory);
    }
}
