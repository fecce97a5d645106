package com.ryuqq.pipeline.core.error;

/**
 * 변경 구독 실패 (STATE-007).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class WatchException extends PipelineStateException {

    public WatchException(String message) {
        super(ErrorCode.WATCH_ERROR, message);
    }
}
