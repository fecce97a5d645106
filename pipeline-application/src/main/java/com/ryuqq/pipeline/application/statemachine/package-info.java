/**
 * 프로젝트 상태 머신.
 *
 * <p>{@link com.ryuqq.pipeline.application.statemachine.ProjectStateMachine}이 전이 그래프
 * ({@link com.ryuqq.pipeline.core.statemachine.TransitionGraph})를 저장소의 progress 섹션에 적용합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.statemachine;
