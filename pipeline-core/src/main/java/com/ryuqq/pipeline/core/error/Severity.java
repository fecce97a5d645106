package com.ryuqq.pipeline.core.error;

/**
 * 오류 심각도.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
