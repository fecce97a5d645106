package com.ryuqq.pipeline.core.statemachine;

import java.util.Set;

/**
 * 단일 상태에서 나가는 전이 규칙.
 *
 * @param normal 정상 전이 대상 (취소 포함)
 * @param recovery 복구용 되돌림 대상
 * @param skipTo 건너뛰기 대상
 * @param required 필수 단계 여부 (건너뛰려면 강제 옵션 필요)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record TransitionRule(
    Set<ProjectState> normal,
    Set<ProjectState> recovery,
    Set<ProjectState> skipTo,
    boolean required
) {

    public TransitionRule {
        normal = Set.copyOf(normal);
        recovery = Set.copyOf(recovery);
        skipTo = Set.copyOf(skipTo);
    }

    /**
     * 나가는 간선이 없는 종료 규칙.
     */
    static TransitionRule terminal(boolean required) {
        return new TransitionRule(Set.of(), Set.of(), Set.of(), required);
    }
}
