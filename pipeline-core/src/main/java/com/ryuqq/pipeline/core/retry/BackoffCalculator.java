package com.ryuqq.pipeline.core.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>잠금 폴링과 작업 재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 여러 프로세스가 같은 시점에 다시 경합하는 것을 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, maxDelay=5000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 100ms + jitter(0-10ms)</li>
 *   <li>attemptCount=2: 200ms + jitter(0-20ms)</li>
 *   <li>attemptCount=3: 400ms + jitter(0-40ms)</li>
 *   <li>attemptCount=7: 6400ms (capped at maxDelay=5000ms)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=100ms, maxDelay=5000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(100, 5000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param random [0, 1) 범위 값을 돌려주는 공급자
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 현재 재시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초, maxDelayMs 이하)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 지수적 백오프 (시프트 전에 상한을 비교하여 overflow 방지)
        int shift = attemptCount - 1;
        long exponential = shift >= 62 || baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : baseDelayMs << shift;

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        // 3. 최대값 제한
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
