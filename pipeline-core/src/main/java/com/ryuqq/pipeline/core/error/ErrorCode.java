package com.ryuqq.pipeline.core.error;

/**
 * 안정적인 네임스페이스 오류 코드.
 *
 * <p>코드 문자열은 로그와 외부 도구가 의존하므로 변경하지 않습니다.
 * 각 코드는 기본 분류와 심각도를 가집니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ErrorCode {

    PROJECT_NOT_FOUND("STATE-001", ErrorCategory.FATAL, Severity.MEDIUM),
    SECTION_NOT_FOUND("STATE-002", ErrorCategory.FATAL, Severity.MEDIUM),
    PROJECT_ALREADY_EXISTS("STATE-003", ErrorCategory.FATAL, Severity.MEDIUM),
    INVALID_TRANSITION("STATE-004", ErrorCategory.FATAL, Severity.HIGH),
    VALIDATION_FAILED("STATE-005", ErrorCategory.FATAL, Severity.MEDIUM),
    HISTORY_ERROR("STATE-006", ErrorCategory.FATAL, Severity.MEDIUM),
    WATCH_ERROR("STATE-007", ErrorCategory.FATAL, Severity.LOW),
    INVALID_SKIP("STATE-008", ErrorCategory.FATAL, Severity.HIGH),
    REQUIRED_STAGE_SKIPPED("STATE-009", ErrorCategory.FATAL, Severity.HIGH),

    LOCK_ACQUISITION_FAILED("LOCK-001", ErrorCategory.TRANSIENT, Severity.MEDIUM),
    LOCK_LOST("LOCK-002", ErrorCategory.TRANSIENT, Severity.HIGH),

    STORAGE_IO("STORE-001", ErrorCategory.TRANSIENT, Severity.MEDIUM),
    STORAGE_CORRUPT("STORE-002", ErrorCategory.FATAL, Severity.CRITICAL),

    STAGE_RECOVERABLE("STAGE-001", ErrorCategory.RECOVERABLE, Severity.MEDIUM),

    RETRY_EXHAUSTED("RETRY-001", ErrorCategory.FATAL, Severity.HIGH);

    private final String code;
    private final ErrorCategory category;
    private final Severity severity;

    ErrorCode(String code, ErrorCategory category, Severity severity) {
        this.code = code;
        this.category = category;
        this.severity = severity;
    }

    /**
     * 코드 문자열 (예: "STATE-004").
     */
    public String code() {
        return code;
    }

    public ErrorCategory category() {
        return category;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * 코드 문자열로 조회.
     *
     * @throws IllegalArgumentException 알 수 없는 코드인 경우
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
