package com.ryuqq.pipeline.core.statemachine;

import java.util.List;

/**
 * 단계 건너뛰기 결과.
 *
 * @param transition 실제 기록된 전이
 * @param skippedStages 건너뛴 정규 단계 (순서대로)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record SkipResult(TransitionResult transition, List<ProjectState> skippedStages) {

    public SkipResult {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        skippedStages = skippedStages == null ? List.of() : List.copyOf(skippedStages);
    }
}
