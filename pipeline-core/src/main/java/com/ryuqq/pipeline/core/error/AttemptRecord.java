package com.ryuqq.pipeline.core.error;

/**
 * 재시도 실행 중 실패한 시도 한 건.
 *
 * @param attempt 시도 번호 (1부터)
 * @param category 분류 결과
 * @param errorCode 오류 코드 (코어 예외가 아니면 예외 클래스 이름)
 * @param message 오류 메시지
 * @param durationMs 시도 소요 시간
 * @param delayMs 다음 시도 전 대기 시간 (마지막 시도는 0)
 * @param remediated 다음 시도 전에 복구 작업을 수행했는지 여부
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record AttemptRecord(
    int attempt,
    ErrorCategory category,
    String errorCode,
    String message,
    long durationMs,
    long delayMs,
    boolean remediated
) {

    public AttemptRecord {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
    }
}
