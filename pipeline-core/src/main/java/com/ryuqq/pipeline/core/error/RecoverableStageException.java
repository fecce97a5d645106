package com.ryuqq.pipeline.core.error;

import java.util.Map;

/**
 * 의존 프로세스가 조치할 수 있는 단계 오류 (STAGE-001, RECOVERABLE).
 *
 * <p>단계 처리기가 발생시키며, 재시도 실행기는 복구 작업을 수행한 뒤 다시 시도합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class RecoverableStageException extends PipelineStateException {

    public RecoverableStageException(String message) {
        super(ErrorCode.STAGE_RECOVERABLE, message);
    }

    public RecoverableStageException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.STAGE_RECOVERABLE, message, context, cause);
    }
}
