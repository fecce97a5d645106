package com.ryuqq.pipeline.core.error;

import java.util.List;

/**
 * 재시도 한도 소진 (RETRY-001, FATAL).
 *
 * <p>모든 시도 기록을 순서대로 담고, 마지막 실패를 cause로 가집니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends PipelineStateException {

    private final String operationName;
    private final List<AttemptRecord> attempts;

    public RetryExhaustedException(String operationName, List<AttemptRecord> attempts, Throwable lastFailure) {
        super(ErrorCode.RETRY_EXHAUSTED,
            "Operation '" + operationName + "' failed after " + attempts.size() + " attempt(s): "
                + (lastFailure == null ? "unknown" : lastFailure.getMessage()),
            context("operation", operationName, "attempts", attempts.size()),
            lastFailure);
        this.operationName = operationName;
        this.attempts = List.copyOf(attempts);
    }

    public String getOperationName() {
        return operationName;
    }

    public List<AttemptRecord> getAttempts() {
        return attempts;
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
