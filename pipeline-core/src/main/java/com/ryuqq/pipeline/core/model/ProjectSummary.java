package com.ryuqq.pipeline.core.model;

import com.ryuqq.pipeline.core.statemachine.ProjectState;

/**
 * 프로젝트 상태 요약.
 *
 * @param projectId 프로젝트 ID
 * @param name 프로젝트 이름
 * @param currentState 현재 파이프라인 상태
 * @param lastUpdated progress Section 마지막 갱신 시각 (epoch 밀리초)
 * @param historyCount progress Section 이력 개수
 * @param progressPercent 진행률 (0~100)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ProjectSummary(
    ProjectId projectId,
    String name,
    ProjectState currentState,
    long lastUpdated,
    int historyCount,
    int progressPercent
) {

    public ProjectSummary {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (currentState == null) {
            throw new IllegalArgumentException("currentState cannot be null");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException(
                "progressPercent must be between 0 and 100 (current: " + progressPercent + ")"
            );
        }
    }
}
