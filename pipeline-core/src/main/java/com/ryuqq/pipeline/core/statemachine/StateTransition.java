package com.ryuqq.pipeline.core.statemachine;

import com.ryuqq.pipeline.core.error.InvalidTransitionException;

/**
 * 표준 그래프 기준 상태 전이 검증 및 실행.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(MERGED, CANCELLED)에서는 어떤 상태로도 전이 불가 (CANCELLED 재진입 포함)</li>
 *   <li>{@link TransitionGraph#standard()}에 정의된 정상 간선만 허용</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTransitionException 그래프에 간선이 없는 경우
     */
    public static void validate(ProjectState from, ProjectState to) {
        validate(TransitionGraph.standard(), from, to);
    }

    /**
     * 지정한 그래프 기준으로 전이 검증.
     */
    public static void validate(TransitionGraph graph, ProjectState from, ProjectState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!graph.isValidTransition(from, to)) {
            throw InvalidTransitionException.of(from, to, graph.validTransitions(from));
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws InvalidTransitionException 유효하지 않은 전이인 경우
     */
    public static ProjectState transition(ProjectState current, ProjectState next) {
        validate(current, next);
        return next;
    }

    /**
     * 상태의 진행률 (0-100).
     *
     * <p>정규 단계 목록 내 위치로 계산합니다: {@code round(index * 100 / (size - 1))}.
     * CANCELLED는 목록에 없으므로 0을 반환합니다.</p>
     *
     * @param state 상태
     * @return 진행률
     */
    public static int progressPercent(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        int index = state.stageIndex();
        if (index < 0) {
            return 0;
        }
        int last = ProjectState.canonicalStages().size() - 1;
        return (int) Math.round(index * 100.0 / last);
    }
}
