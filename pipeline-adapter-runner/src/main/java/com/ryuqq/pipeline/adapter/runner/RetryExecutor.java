package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.error.AttemptRecord;
import com.ryuqq.pipeline.core.error.ErrorCategory;
import com.ryuqq.pipeline.core.error.ErrorClassifier;
import com.ryuqq.pipeline.core.error.RetryExhaustedException;
import com.ryuqq.pipeline.core.retry.RetryPolicies;
import com.ryuqq.pipeline.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 분류 기반 재시도 실행기.
 *
 * <p>작업이 실패하면 {@link ErrorClassifier}로 분류하고 분류별 {@link RetryPolicy}에 따라
 * 재시도 여부와 대기 시간을 결정합니다.</p>
 *
 * <p><strong>분류별 처리:</strong></p>
 * <ul>
 *   <li>TRANSIENT: 지수 백오프 후 재시도 (정책의 maxAttempts까지)</li>
 *   <li>RECOVERABLE: 보정 작업 실행 후 재시도. 보정 작업이 없으면 즉시 중단</li>
 *   <li>FATAL: 재시도 없이 원래 예외를 그대로 전파</li>
 * </ul>
 *
 * <p>재시도 한도를 넘거나 중단되면 모든 시도 기록을 담은 {@link RetryExhaustedException}을
 * 던집니다. 마지막 실패가 cause로 연결됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. operation.get() 실행
 * 2. 성공 → 결과 반환
 * 3. 실패 → classify(error)
 *    - FATAL → 그대로 throw
 *    - 분류별 실패 횟수 >= maxAttempts → RetryExhaustedException
 *    - RECOVERABLE → remediation.remediate(error)
 *    - backoff.calculate(n) 만큼 대기 후 1로
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ErrorClassifier classifier;
    private final RetryPolicies policies;
    private final Sleeper sleeper;

    public RetryExecutor() {
        this(new ErrorClassifier(), RetryPolicies.defaults(), Sleeper.THREAD);
    }

    /**
     * 생성자.
     *
     * @param classifier 오류 분류기
     * @param policies 분류별 재시도 정책
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryExecutor(ErrorClassifier classifier, RetryPolicies policies, Sleeper sleeper) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.classifier = classifier;
        this.policies = policies;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operationName, Supplier<T> operation) {
        return execute(operationName, operation, null);
    }

    public void run(String operationName, Runnable operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        execute(operationName, () -> {
            operation.run();
            return null;
        }, null);
    }

    /**
     * 작업 실행.
     *
     * @param operationName 로그와 예외에 사용할 작업 이름
     * @param operation 실행할 작업
     * @param remediation RECOVERABLE 실패 보정 작업 (null이면 보정 없음)
     * @return 작업 결과
     * @throws RetryExhaustedException 재시도 한도 초과 또는 보정 불가
     * @throws RuntimeException FATAL 분류 예외 (원본 그대로)
     */
    public <T> T execute(String operationName, Supplier<T> operation, Remediation remediation) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        List<AttemptRecord> attempts = new ArrayList<>();
        Map<ErrorCategory, Integer> failures = new EnumMap<>(ErrorCategory.class);
        int attempt = 0;

        while (true) {
            attempt++;
            long startedAt = System.nanoTime();
            RuntimeException failure;
            try {
                return operation.get();
            } catch (RuntimeException e) {
                failure = e;
            }
            long durationMs = (System.nanoTime() - startedAt) / 1_000_000;

            ErrorCategory category = classifier.classify(failure);
            String errorCode = classifier.errorCodeOf(failure);
            if (category == ErrorCategory.FATAL) {
                if (attempt > 1) {
                    log.warn("Operation '{}' failed fatally on attempt {} [{}]: {}",
                        operationName, attempt, errorCode, failure.getMessage());
                }
                throw failure;
            }

            RetryPolicy policy = policies.forCategory(category);
            int categoryFailures = failures.merge(category, 1, Integer::sum);
            boolean canRetry = categoryFailures < policy.maxAttempts();

            if (category == ErrorCategory.RECOVERABLE && remediation == null) {
                attempts.add(new AttemptRecord(attempt, category, errorCode, failure.getMessage(),
                    durationMs, 0, false));
                log.warn("Operation '{}' hit recoverable failure [{}] with no remediation, escalating: {}",
                    operationName, errorCode, failure.getMessage());
                throw new RetryExhaustedException(operationName, attempts, failure);
            }
            if (!canRetry) {
                attempts.add(new AttemptRecord(attempt, category, errorCode, failure.getMessage(),
                    durationMs, 0, false));
                log.warn("Operation '{}' exhausted {} {} attempt(s) [{}]: {}",
                    operationName, categoryFailures, category, errorCode, failure.getMessage());
                throw new RetryExhaustedException(operationName, attempts, failure);
            }

            boolean remediated = false;
            if (category == ErrorCategory.RECOVERABLE) {
                try {
                    remediation.remediate(failure);
                    remediated = true;
                } catch (RuntimeException remediationFailure) {
                    remediationFailure.addSuppressed(failure);
                    attempts.add(new AttemptRecord(attempt, category, errorCode, failure.getMessage(),
                        durationMs, 0, false));
                    log.warn("Remediation for '{}' failed: {}", operationName, remediationFailure.getMessage());
                    throw new RetryExhaustedException(operationName, attempts, remediationFailure);
                }
            }

            long delayMs = policy.backoff().calculate(categoryFailures);
            attempts.add(new AttemptRecord(attempt, category, errorCode, failure.getMessage(),
                durationMs, delayMs, remediated));
            log.warn("Operation '{}' attempt {} failed [{} {}], retrying in {}ms: {}",
                operationName, attempt, category, errorCode, delayMs, failure.getMessage());
            sleep(operationName, attempts, delayMs);
        }
    }

    private void sleep(String operationName, List<AttemptRecord> attempts, long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryExhaustedException(operationName, attempts, e);
        }
    }
}
