package com.ryuqq.pipeline.core.error;

/**
 * 제한 시간 내 잠금 획득 실패 (LOCK-001, TRANSIENT).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class LockAcquisitionException extends PipelineStateException {

    private final String resource;

    public LockAcquisitionException(String resource, long timeoutMs) {
        super(ErrorCode.LOCK_ACQUISITION_FAILED,
            "Failed to acquire lock on " + resource + " within " + timeoutMs + "ms",
            context("resource", resource, "timeoutMs", timeoutMs));
        this.resource = resource;
    }

    public LockAcquisitionException(String resource, String message, Throwable cause) {
        super(ErrorCode.LOCK_ACQUISITION_FAILED, message, context("resource", resource), cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
