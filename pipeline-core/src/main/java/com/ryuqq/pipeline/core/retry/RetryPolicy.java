package com.ryuqq.pipeline.core.retry;

/**
 * 오류 분류별 재시도 정책.
 *
 * @param maxAttempts 최초 시도를 포함한 최대 시도 횟수 (1이면 재시도 없음)
 * @param baseDelayMs 첫 재시도 전 기본 지연 (밀리초)
 * @param maxDelayMs 지연 상한 (밀리초)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {

    private static final RetryPolicy NO_RETRY = new RetryPolicy(1, 1, 1, 0.0);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        // BackoffCalculator와 같은 규칙으로 검증
        new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 재시도하지 않는 정책 (FATAL 기본값). 지연 값은 사용되지 않습니다.
     */
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public boolean allowsRetry() {
        return maxAttempts > 1;
    }

    /**
     * 정책에 맞는 백오프 계산기.
     */
    public BackoffCalculator backoff() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withDelays(long baseDelayMs, long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
