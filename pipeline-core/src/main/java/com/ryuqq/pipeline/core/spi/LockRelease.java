package com.ryuqq.pipeline.core.spi;

/**
 * 잠금 해제 결과.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum LockRelease {

    RELEASED,

    /**
     * 다른 보유자의 잠금이거나 잠금이 없음. 잠금은 그대로 유지됩니다.
     */
    NOT_HOLDER
}
