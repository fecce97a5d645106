/**
 * Retry policies and backoff.
 *
 * <p>{@link com.ryuqq.pipeline.core.retry.RetryPolicies} maps each error category to a
 * {@link com.ryuqq.pipeline.core.retry.RetryPolicy}; delays come from
 * {@link com.ryuqq.pipeline.core.retry.BackoffCalculator}, which the file lock manager
 * also uses when polling a contended lock.</p>
 */
package com.ryuqq.pipeline.core.retry;
