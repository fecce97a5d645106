/**
 * Collaborator-facing coordination API.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.coordinator.StateCoordinator} - operations consumed by stage processors</li>
 *   <li>{@link com.ryuqq.pipeline.application.coordinator.DefaultStateCoordinator} - retry-wrapped implementation</li>
 *   <li>{@link com.ryuqq.pipeline.application.coordinator.StateCoordinators} - file-backed wiring</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * application (StateCoordinator, ProjectStateMachine)
 *   ↓ depends on
 * adapter-file (FileLockManager, FileStateStore)
 * adapter-inmemory (InMemoryChangeNotifier)
 * adapter-runner (RetryExecutor)
 *   ↓ depends on
 * core (model, SPI, errors, transition graph)
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.coordinator;
