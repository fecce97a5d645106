package com.ryuqq.pipeline.core.statemachine;

/**
 * 상태 전이 결과.
 *
 * @param previousState 전이 전 상태
 * @param newState 전이 후 상태
 * @param timestamp 전이 시각 (epoch millis)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record TransitionResult(ProjectState previousState, ProjectState newState, long timestamp) {

    public TransitionResult {
        if (previousState == null) {
            throw new IllegalArgumentException("previousState cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
    }
}
