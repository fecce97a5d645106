package com.ryuqq.pipeline.core.model;

/**
 * Section 갱신 옵션.
 *
 * <ul>
 *   <li>merge=true: 현재 객체 값에 patch를 얕게 병합 ({@code {...current, ...patch}})</li>
 *   <li>merge=false: patch로 전체 교체</li>
 * </ul>
 *
 * @param merge 병합 여부 (기본 true)
 * @param description 이력에 남길 설명 (선택, null 가능)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record UpdateOptions(boolean merge, String description) {

    private static final UpdateOptions DEFAULTS = new UpdateOptions(true, null);

    public static UpdateOptions defaults() {
        return DEFAULTS;
    }

    public static UpdateOptions replace() {
        return new UpdateOptions(false, null);
    }

    public UpdateOptions withMerge(boolean merge) {
        return new UpdateOptions(merge, description);
    }

    public UpdateOptions withDescription(String description) {
        return new UpdateOptions(merge, description);
    }
}
