/**
 * In-memory reference {@link com.ryuqq.pipeline.core.spi.StateStore}.
 *
 * <p>Used by unit tests of the state machine and by callers that need the store semantics
 * without a filesystem. Not suitable for multi-process coordination.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.store;
