package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.statemachine.ProjectState;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 입력 또는 상태 검증 실패 (STATE-005, 필수 단계 건너뛰기는 STATE-009).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StateValidationException extends PipelineStateException {

    public StateValidationException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }

    public StateValidationException(String message, Map<String, ?> context) {
        super(ErrorCode.VALIDATION_FAILED, message, context);
    }

    private StateValidationException(ErrorCode errorCode, String message, Map<String, ?> context) {
        super(errorCode, message, context);
    }

    /**
     * 강제 옵션 없이 필수 단계를 건너뛰려는 경우.
     */
    public static StateValidationException requiredStagesSkipped(ProjectState from, ProjectState to,
                                                                  List<ProjectState> required) {
        String stages = required.stream().map(ProjectState::id).collect(Collectors.joining(", "));
        return new StateValidationException(ErrorCode.REQUIRED_STAGE_SKIPPED,
            String.format("Cannot skip required stages from %s to %s: %s", from, to, stages),
            context("from", from.id(), "to", to.id(), "requiredStages", stages));
    }
}
