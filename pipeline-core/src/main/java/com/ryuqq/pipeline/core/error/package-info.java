/**
 * Error taxonomy and classification.
 *
 * <p>Every failure raised by the coordination core is a
 * {@link com.ryuqq.pipeline.core.error.PipelineStateException} carrying a stable
 * {@link com.ryuqq.pipeline.core.error.ErrorCode}. The code fixes the
 * {@link com.ryuqq.pipeline.core.error.ErrorCategory} that decides retry eligibility:</p>
 *
 * <ul>
 *   <li>{@code TRANSIENT} - lock contention, filesystem contention, timeouts</li>
 *   <li>{@code RECOVERABLE} - stage failures a remediation step can fix</li>
 *   <li>{@code FATAL} - invalid transitions, missing projects, corrupt records</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.pipeline.core.error.ErrorClassifier} maps arbitrary throwables
 * (including JDK IO exceptions) onto the same categories.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.error;
