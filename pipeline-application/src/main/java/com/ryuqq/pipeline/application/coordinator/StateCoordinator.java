package com.ryuqq.pipeline.application.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ProjectSummary;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import com.ryuqq.pipeline.core.spi.ChangeListener;
import com.ryuqq.pipeline.core.spi.Subscription;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import com.ryuqq.pipeline.core.statemachine.SkipOptions;
import com.ryuqq.pipeline.core.statemachine.SkipResult;
import com.ryuqq.pipeline.core.statemachine.TransitionResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pipeline state coordination entry point for stage processors.
 *
 * <p>All access to project state goes through this interface so that locking, versioning and
 * history invariants hold. Stage processors never touch the backing files directly.</p>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>Fatal errors (not found, invalid transition, validation) propagate unchanged without retry</li>
 *   <li>Transient errors (lock contention, filesystem IO) retry transparently up to the policy
 *       ceiling, then surface as {@link com.ryuqq.pipeline.core.error.RetryExhaustedException}</li>
 * </ul>
 *
 * <p><strong>Reserved Section:</strong></p>
 * <p>{@link SectionName#PROGRESS} is written only by the state operations
 * ({@link #initializeProject}, {@link #transition}, {@link #skipTo}, {@link #recoverTo}).
 * Direct writes to it fail with {@link com.ryuqq.pipeline.core.error.StateValidationException}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (StateCoordinator coordinator = StateCoordinators.fileBacked(CoordinationConfig.defaults(base))) {
 *     ProjectId id = ProjectId.of("001");
 *     coordinator.initializeProject(id, "Order Service");
 *     coordinator.updateSection(id, SectionName.INFO, patch, UpdateOptions.defaults());
 *     coordinator.transition(id, ProjectState.CLARIFYING);
 * }
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface StateCoordinator extends AutoCloseable {

    // ==================== Projects ====================

    /**
     * Creates the project and records its initial state ({@code collecting}).
     */
    ProjectSummary initializeProject(ProjectId projectId, String name);

    ProjectSummary initializeProject(ProjectId projectId, String name, ProjectState initialState);

    /**
     * Deletes the project with all its sections and drops its subscriptions.
     *
     * @return deleted sections
     */
    List<SectionName> deleteProject(ProjectId projectId);

    List<ProjectId> listProjects();

    ProjectSummary summary(ProjectId projectId);

    /**
     * Newest-first {@code progress} history entries.
     */
    List<HistoryEntry> recentActivity(ProjectId projectId, int limit);

    // ==================== Sections ====================

    Optional<SectionSnapshot> readSection(ProjectId projectId, SectionName section, ReadOptions options);

    SectionSnapshot writeSection(ProjectId projectId, SectionName section, JsonNode value, String description);

    SectionSnapshot updateSection(ProjectId projectId, SectionName section, JsonNode patch, UpdateOptions options);

    List<HistoryEntry> getHistory(ProjectId projectId, SectionName section);

    SectionSnapshot restoreFromHistory(ProjectId projectId, SectionName section, long sequence);

    /**
     * Current section version; 0 if never written. Other processes poll this to observe changes.
     */
    long version(ProjectId projectId, SectionName section);

    // ==================== State ====================

    TransitionResult transition(ProjectId projectId, ProjectState target);

    SkipResult skipTo(ProjectId projectId, ProjectState target, SkipOptions options);

    TransitionResult recoverTo(ProjectId projectId, ProjectState target, String reason);

    ProjectState currentState(ProjectId projectId);

    Set<ProjectState> validTransitions(ProjectState state);

    // ==================== Watch ====================

    /**
     * Registers an in-process listener for changes of the project.
     *
     * @param section section to watch, or null for every section
     * @throws com.ryuqq.pipeline.core.error.WatchException if the project is unknown or the
     *         coordinator is closed
     */
    Subscription watch(ProjectId projectId, ChangeListener listener, SectionName section);

    /**
     * Releases held locks, stops heartbeats and drops every subscription.
     */
    @Override
    void close();
}
