/**
 * Service Provider Interfaces of the coordination core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.spi.LockManager} - advisory cross-process locks</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.StateStore} - versioned section storage</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ChangeNotifier} - in-process change fan-out</li>
 * </ul>
 *
 * <p>The file adapter implements the lock manager and the store; the in-memory adapter
 * implements the notifier and a reference store for tests.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.spi;
