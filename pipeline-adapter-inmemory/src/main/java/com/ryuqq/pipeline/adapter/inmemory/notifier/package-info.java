/**
 * In-process change notification.
 *
 * <p>{@link com.ryuqq.pipeline.adapter.inmemory.notifier.InMemoryChangeNotifier} fans
 * {@link com.ryuqq.pipeline.core.model.StateChangeEvent}s out to listeners registered in the same
 * JVM. It is the notifier used by the file-backed coordinator.</p>
 *
 * @see com.ryuqq.pipeline.core.spi.ChangeNotifier
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.notifier;
