package com.ryuqq.pipeline.core.retry;

import com.ryuqq.pipeline.core.error.ErrorCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 오류 분류와 재시도 정책의 대응표.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>TRANSIENT: 5회, 100ms 기본, 5s 상한, jitter 0.25</li>
 *   <li>RECOVERABLE: 3회, 1s 기본, 30s 상한, jitter 0.1</li>
 *   <li>FATAL: 1회 (재시도 없음)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class RetryPolicies {

    public static final RetryPolicy DEFAULT_TRANSIENT = new RetryPolicy(5, 100, 5_000, 0.25);
    public static final RetryPolicy DEFAULT_RECOVERABLE = new RetryPolicy(3, 1_000, 30_000, 0.1);

    private static final RetryPolicies DEFAULTS = new RetryPolicies(
        DEFAULT_TRANSIENT, DEFAULT_RECOVERABLE, RetryPolicy.noRetry());

    private final Map<ErrorCategory, RetryPolicy> policies;

    public RetryPolicies(RetryPolicy transientPolicy, RetryPolicy recoverablePolicy, RetryPolicy fatalPolicy) {
        if (transientPolicy == null || recoverablePolicy == null || fatalPolicy == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (fatalPolicy.allowsRetry()) {
            throw new IllegalArgumentException(
                "fatal policy must not retry (maxAttempts: " + fatalPolicy.maxAttempts() + ")");
        }
        EnumMap<ErrorCategory, RetryPolicy> map = new EnumMap<>(ErrorCategory.class);
        map.put(ErrorCategory.TRANSIENT, transientPolicy);
        map.put(ErrorCategory.RECOVERABLE, recoverablePolicy);
        map.put(ErrorCategory.FATAL, fatalPolicy);
        this.policies = Collections.unmodifiableMap(map);
    }

    public static RetryPolicies defaults() {
        return DEFAULTS;
    }

    /**
     * 분류에 해당하는 정책.
     *
     * @param category 오류 분류
     * @return 정책
     */
    public RetryPolicy forCategory(ErrorCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return policies.get(category);
    }

    public RetryPolicies withTransient(RetryPolicy policy) {
        return new RetryPolicies(policy, policies.get(ErrorCategory.RECOVERABLE), policies.get(ErrorCategory.FATAL));
    }

    public RetryPolicies withRecoverable(RetryPolicy policy) {
        return new RetryPolicies(policies.get(ErrorCategory.TRANSIENT), policy, policies.get(ErrorCategory.FATAL));
    }
}
