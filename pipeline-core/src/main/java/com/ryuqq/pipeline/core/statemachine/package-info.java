/**
 * Pipeline state graph.
 *
 * <p>{@link com.ryuqq.pipeline.core.statemachine.ProjectState} enumerates the stages,
 * {@link com.ryuqq.pipeline.core.statemachine.TransitionGraph} holds the normal, recovery
 * and skip edges between them. The engine that persists transitions lives in the
 * application module.</p>
 */
package com.ryuqq.pipeline.core.statemachine;
