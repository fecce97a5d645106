package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.statemachine.ProjectState;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 그래프에 없는 전이 시도 (STATE-004, 건너뛰기는 STATE-008).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends PipelineStateException {

    private final ProjectState from;
    private final ProjectState to;

    private InvalidTransitionException(ErrorCode errorCode, String message, ProjectState from, ProjectState to,
                                       Map<String, Object> context) {
        super(errorCode, message, context);
        this.from = from;
        this.to = to;
    }

    /**
     * 정상 전이 간선이 없는 경우.
     */
    public static InvalidTransitionException of(ProjectState from, ProjectState to, Set<ProjectState> allowed) {
        String message = from.isTerminal()
            ? String.format("Cannot transition from terminal state: %s -> %s", from, to)
            : String.format("Invalid state transition: %s -> %s (allowed: %s)", from, to, sorted(allowed));
        return new InvalidTransitionException(ErrorCode.INVALID_TRANSITION, message, from, to,
            context("from", from.id(), "to", to.id()));
    }

    /**
     * 건너뛰기 간선이 없는 경우.
     */
    public static InvalidTransitionException invalidSkip(ProjectState from, ProjectState to, Set<ProjectState> allowed) {
        return new InvalidTransitionException(ErrorCode.INVALID_SKIP,
            String.format("Cannot skip from %s to %s (allowed: %s)", from, to, sorted(allowed)),
            from, to, context("from", from.id(), "to", to.id(), "operation", "skip"));
    }

    /**
     * 복구 간선이 없는 경우.
     */
    public static InvalidTransitionException invalidRecovery(ProjectState from, ProjectState to, Set<ProjectState> allowed) {
        return new InvalidTransitionException(ErrorCode.INVALID_TRANSITION,
            String.format("Cannot recover from %s to %s (allowed: %s)", from, to, sorted(allowed)),
            from, to, context("from", from.id(), "to", to.id(), "operation", "recover"));
    }

    /**
     * 프로젝트 ID를 컨텍스트에 추가한 사본.
     */
    public InvalidTransitionException withProject(Object projectId) {
        Map<String, Object> context = context("projectId", projectId);
        context.putAll(getContext());
        return new InvalidTransitionException(getErrorCode(), getMessage(), from, to, context);
    }

    public ProjectState getFrom() {
        return from;
    }

    public ProjectState getTo() {
        return to;
    }

    private static String sorted(Set<ProjectState> states) {
        Set<String> ids = new TreeSet<>();
        for (ProjectState state : states) {
            ids.add(state.id());
        }
        return ids.isEmpty() ? "none" : String.join(", ", ids);
    }
}
