package com.ryuqq.pipeline.core.statemachine;

/**
 * 단계 건너뛰기 옵션.
 *
 * @param forceSkipRequired 필수 단계도 건너뛸지 여부
 * @param reason 건너뛰는 사유 (선택)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record SkipOptions(boolean forceSkipRequired, String reason) {

    private static final SkipOptions DEFAULTS = new SkipOptions(false, null);

    public static SkipOptions defaults() {
        return DEFAULTS;
    }

    public static SkipOptions forced(String reason) {
        return new SkipOptions(true, reason);
    }

    public SkipOptions withReason(String reason) {
        return new SkipOptions(forceSkipRequired, reason);
    }
}
