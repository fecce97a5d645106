package com.ryuqq.pipeline.core.spi;

/**
 * 잠금 획득 결과.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum LockAcquisition {
    GRANTED,
    TIMED_OUT;

    public boolean isGranted() {
        return this == GRANTED;
    }
}
