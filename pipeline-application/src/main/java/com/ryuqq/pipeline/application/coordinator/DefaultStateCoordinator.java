package com.ryuqq.pipeline.application.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.pipeline.adapter.runner.RetryExecutor;
import com.ryuqq.pipeline.application.statemachine.ProjectStateMachine;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.error.WatchException;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ProjectSummary;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import com.ryuqq.pipeline.core.spi.ChangeListener;
import com.ryuqq.pipeline.core.spi.ChangeNotifier;
import com.ryuqq.pipeline.core.spi.LockManager;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.spi.Subscription;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import com.ryuqq.pipeline.core.statemachine.SkipOptions;
import com.ryuqq.pipeline.core.statemachine.SkipResult;
import com.ryuqq.pipeline.core.statemachine.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * StateCoordinator 기본 구현.
 *
 * <p>저장소와 상태 머신 호출을 {@link RetryExecutor}로 감싸 일시적 오류를 투명하게 재시도합니다.
 * 치명적 오류는 재시도 없이 그대로 전파됩니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>StateStore: 섹션 저장/이력</li>
 *   <li>ProjectStateMachine: progress 섹션 상태 전이</li>
 *   <li>ChangeNotifier: 프로세스 내 변경 구독</li>
 *   <li>LockManager: close 시 하트비트 중지 및 잠금 해제</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class DefaultStateCoordinator implements StateCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DefaultStateCoordinator.class);

    private final StateStore store;
    private final ProjectStateMachine stateMachine;
    private final ChangeNotifier notifier;
    private final LockManager lockManager;
    private final RetryExecutor retry;
    private volatile boolean closed;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultStateCoordinator(StateStore store, ProjectStateMachine stateMachine, ChangeNotifier notifier,
                                   LockManager lockManager, RetryExecutor retry) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (stateMachine == null) {
            throw new IllegalArgumentException("stateMachine cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (lockManager == null) {
            throw new IllegalArgumentException("lockManager cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        this.store = store;
        this.stateMachine = stateMachine;
        this.notifier = notifier;
        this.lockManager = lockManager;
        this.retry = retry;
    }

    // ==================== 프로젝트 ====================

    @Override
    public ProjectSummary initializeProject(ProjectId projectId, String name) {
        return retry.execute("initializeProject", () -> stateMachine.initializeProject(projectId, name));
    }

    @Override
    public ProjectSummary initializeProject(ProjectId projectId, String name, ProjectState initialState) {
        return retry.execute("initializeProject",
            () -> stateMachine.initializeProject(projectId, name, initialState));
    }

    @Override
    public List<SectionName> deleteProject(ProjectId projectId) {
        return retry.execute("deleteProject", () -> store.deleteProject(projectId));
    }

    @Override
    public List<ProjectId> listProjects() {
        return retry.execute("listProjects", store::listProjects);
    }

    @Override
    public ProjectSummary summary(ProjectId projectId) {
        return retry.execute("summary", () -> stateMachine.summary(projectId));
    }

    @Override
    public List<HistoryEntry> recentActivity(ProjectId projectId, int limit) {
        return retry.execute("recentActivity", () -> stateMachine.recentActivity(projectId, limit));
    }

    // ==================== 섹션 ====================

    @Override
    public Optional<SectionSnapshot> readSection(ProjectId projectId, SectionName section, ReadOptions options) {
        return retry.execute("readSection", () -> store.readSection(projectId, section, options));
    }

    @Override
    public SectionSnapshot writeSection(ProjectId projectId, SectionName section, JsonNode value, String description) {
        requireWritable(projectId, section);
        return retry.execute("writeSection", () -> store.writeSection(projectId, section, value, description));
    }

    @Override
    public SectionSnapshot updateSection(ProjectId projectId, SectionName section, JsonNode patch,
                                         UpdateOptions options) {
        requireWritable(projectId, section);
        return retry.execute("updateSection", () -> store.updateSection(projectId, section, patch, options));
    }

    @Override
    public List<HistoryEntry> getHistory(ProjectId projectId, SectionName section) {
        return retry.execute("getHistory", () -> store.getHistory(projectId, section));
    }

    @Override
    public SectionSnapshot restoreFromHistory(ProjectId projectId, SectionName section, long sequence) {
        requireWritable(projectId, section);
        return retry.execute("restoreFromHistory", () -> store.restoreFromHistory(projectId, section, sequence));
    }

    @Override
    public long version(ProjectId projectId, SectionName section) {
        return retry.execute("version", () -> store.version(projectId, section));
    }

    // ==================== 상태 ====================

    @Override
    public TransitionResult transition(ProjectId projectId, ProjectState target) {
        return retry.execute("transition", () -> stateMachine.transition(projectId, target));
    }

    @Override
    public SkipResult skipTo(ProjectId projectId, ProjectState target, SkipOptions options) {
        return retry.execute("skipTo", () -> stateMachine.skipTo(projectId, target, options));
    }

    @Override
    public TransitionResult recoverTo(ProjectId projectId, ProjectState target, String reason) {
        return retry.execute("recoverTo", () -> stateMachine.recoverTo(projectId, target, reason));
    }

    @Override
    public ProjectState currentState(ProjectId projectId) {
        return retry.execute("currentState", () -> stateMachine.currentState(projectId));
    }

    @Override
    public Set<ProjectState> validTransitions(ProjectState state) {
        return stateMachine.validTransitions(state);
    }

    // ==================== 구독 ====================

    @Override
    public Subscription watch(ProjectId projectId, ChangeListener listener, SectionName section) {
        if (closed) {
            throw new WatchException("State coordinator is closed");
        }
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (!store.projectExists(projectId)) {
            throw new WatchException("Cannot watch unknown project: " + projectId);
        }
        return notifier.subscribe(projectId, section, listener);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            notifier.close();
        } finally {
            lockManager.close();
        }
        log.info("State coordinator closed");
    }

    private static void requireWritable(ProjectId projectId, SectionName section) {
        if (section != null && section.isReserved()) {
            throw new StateValidationException(
                "Section '" + section.getValue() + "' is managed by the state machine; use transition operations",
                Map.of("projectId", projectId == null ? "null" : projectId.getValue(), "section", section.getValue()));
        }
    }
}
