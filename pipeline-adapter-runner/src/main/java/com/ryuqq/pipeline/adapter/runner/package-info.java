/**
 * 실행 보조 컴포넌트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.RetryExecutor}: 오류 분류 기반 재시도</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.StaleLockReaper}: 끊긴 잠금 회수</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.runner;
