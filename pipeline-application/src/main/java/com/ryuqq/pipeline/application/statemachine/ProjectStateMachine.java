package com.ryuqq.pipeline.application.statemachine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.pipeline.core.error.InvalidTransitionException;
import com.ryuqq.pipeline.core.error.ProjectAlreadyExistsException;
import com.ryuqq.pipeline.core.error.SectionNotFoundException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.json.Jsons;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ProjectRecord;
import com.ryuqq.pipeline.core.model.ProjectSummary;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.spi.SectionMutator;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import com.ryuqq.pipeline.core.statemachine.SkipOptions;
import com.ryuqq.pipeline.core.statemachine.SkipResult;
import com.ryuqq.pipeline.core.statemachine.StateTransition;
import com.ryuqq.pipeline.core.statemachine.TransitionGraph;
import com.ryuqq.pipeline.core.statemachine.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 프로젝트 파이프라인 상태 머신.
 *
 * <p>현재 상태는 {@code progress} 섹션에 저장되며, 모든 상태 변경은 해당 섹션에 대한
 * 단일 {@link StateStore#computeSection} 호출로 이루어집니다. 현재 상태 읽기, 간선 검증,
 * 새 상태 기록이 같은 섹션 잠금 안에서 수행되므로 동시에 전이를 시도해도 그래프를 벗어나지 않습니다.</p>
 *
 * <p><strong>progress 값 형식:</strong></p>
 * <pre>
 * {
 *   "state": "clarifying",
 *   "previousState": "collecting",
 *   "transitionedAt": 1700000000000,
 *   "skippedStages": ["clarifying"],   // skipTo 전용
 *   "reason": "..."                    // skipTo/recoverTo, 사유가 있을 때만
 * }
 * </pre>
 *
 * <p><strong>이력 설명:</strong></p>
 * <ul>
 *   <li>초기화: {@code Initial state}</li>
 *   <li>전이: {@code transitioned from X to Y}</li>
 *   <li>건너뛰기: {@code skipped from X to Y (skipped: a, b)}</li>
 *   <li>복구: {@code recovered from X to Y (reason)}</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ProjectStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateMachine.class);

    static final String INITIAL_DESCRIPTION = "Initial state";

    private final StateStore store;
    private final TransitionGraph graph;
    private final Clock clock;

    public ProjectStateMachine(StateStore store) {
        this(store, TransitionGraph.standard(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 상태 저장소
     * @param graph 전이 그래프
     * @param clock 전이 시각 기준
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProjectStateMachine(StateStore store, TransitionGraph graph, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.graph = graph;
        this.clock = clock;
    }

    // ==================== 초기화 / 조회 ====================

    public ProjectSummary initializeProject(ProjectId projectId, String name) {
        return initializeProject(projectId, name, ProjectState.COLLECTING);
    }

    /**
     * 프로젝트 생성 및 초기 상태 기록.
     *
     * <p>프로젝트는 있지만 진행 상태가 없으면 중단된 초기화로 보고 진행 상태만 기록합니다.
     * 재시도해도 안전합니다.</p>
     *
     * @throws ProjectAlreadyExistsException 이미 초기화된 경우
     * @throws StateValidationException 초기 상태가 종료 상태인 경우
     */
    public ProjectSummary initializeProject(ProjectId projectId, String name, ProjectState initialState) {
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        if (initialState.isTerminal()) {
            throw new StateValidationException("Initial state cannot be terminal: " + initialState,
                Map.of("projectId", projectId == null ? "null" : projectId.getValue(), "state", initialState.id()));
        }
        try {
            store.createProject(projectId, name);
        } catch (ProjectAlreadyExistsException e) {
            if (hasProgress(projectId)) {
                throw e;
            }
            // 이전 시도가 프로젝트만 만들고 진행 상태를 남기지 못한 경우 이어서 기록
            log.warn("Project {} exists without progress, resuming initialization", projectId);
        }
        store.computeSection(projectId, SectionName.PROGRESS, current -> {
            if (current.isPresent()) {
                throw new ProjectAlreadyExistsException(projectId);
            }
            return progressValue(initialState, null, clock.millis());
        }, INITIAL_DESCRIPTION);
        log.info("Initialized project {} in state {}", projectId, initialState);
        return summary(projectId);
    }

    private boolean hasProgress(ProjectId projectId) {
        return store.readSection(projectId, SectionName.PROGRESS, ReadOptions.defaults().withAllowMissing(true))
            .isPresent();
    }

    public ProjectState currentState(ProjectId projectId) {
        SectionSnapshot progress = store.readSection(projectId, SectionName.PROGRESS, ReadOptions.defaults())
            .orElseThrow(() -> new SectionNotFoundException(projectId, SectionName.PROGRESS));
        return stateOf(projectId, progress.value());
    }

    public Set<ProjectState> validTransitions(ProjectState state) {
        return graph.validTransitions(state);
    }

    public Set<ProjectState> skipOptions(ProjectState state) {
        return graph.skipOptions(state);
    }

    public Set<ProjectState> recoveryOptions(ProjectState state) {
        return graph.recoveryOptions(state);
    }

    public int progressPercent(ProjectState state) {
        return StateTransition.progressPercent(state);
    }

    public ProjectSummary summary(ProjectId projectId) {
        ProjectRecord project = store.getProject(projectId);
        SectionSnapshot progress = store.readSection(projectId, SectionName.PROGRESS,
                ReadOptions.defaults().withIncludeHistory(true))
            .orElseThrow(() -> new SectionNotFoundException(projectId, SectionName.PROGRESS));
        ProjectState state = stateOf(projectId, progress.value());
        return new ProjectSummary(projectId, project.name(), state, progress.updatedAt(),
            progress.history().size(), StateTransition.progressPercent(state));
    }

    /**
     * 최근 상태 변경 이력 (최신순).
     *
     * @param limit 최대 개수 (양수)
     */
    public List<HistoryEntry> recentActivity(ProjectId projectId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<HistoryEntry> history = new ArrayList<>(store.getHistory(projectId, SectionName.PROGRESS));
        Collections.reverse(history);
        return List.copyOf(history.subList(0, Math.min(limit, history.size())));
    }

    // ==================== 상태 변경 ====================

    /**
     * 정상 간선을 따라 전이.
     *
     * @throws InvalidTransitionException 간선이 없거나 현재 상태가 종료 상태인 경우
     */
    public TransitionResult transition(ProjectId projectId, ProjectState target) {
        requireTarget(target);
        ProgressChange change = new ProgressChange(projectId, target) {
            @Override
            void validate(ProjectState from) {
                if (!graph.isValidTransition(from, target)) {
                    throw InvalidTransitionException.of(from, target, graph.validTransitions(from))
                        .withProject(projectId.getValue());
                }
            }

            @Override
            String describe(ProjectState from) {
                return "transitioned from " + from + " to " + target;
            }
        };
        return commit(change).transition();
    }

    /**
     * 건너뛰기 간선을 따라 전이.
     *
     * @throws InvalidTransitionException 건너뛰기 간선이 없는 경우 (STATE-008)
     * @throws StateValidationException 강제 옵션 없이 필수 단계를 지나치는 경우 (STATE-009)
     */
    public SkipResult skipTo(ProjectId projectId, ProjectState target, SkipOptions options) {
        requireTarget(target);
        SkipOptions effective = options == null ? SkipOptions.defaults() : options;
        ProgressChange change = new ProgressChange(projectId, target) {
            @Override
            void validate(ProjectState from) {
                if (!graph.canSkipTo(from, target)) {
                    throw InvalidTransitionException.invalidSkip(from, target, graph.skipOptions(from))
                        .withProject(projectId.getValue());
                }
                List<ProjectState> required = graph.requiredStagesBetween(from, target);
                if (!required.isEmpty() && !effective.forceSkipRequired()) {
                    throw StateValidationException.requiredStagesSkipped(from, target, required);
                }
                skipped = graph.stagesBetween(from, target);
                reason = effective.reason();
            }

            @Override
            String describe(ProjectState from) {
                String stages = skipped.isEmpty()
                    ? "none"
                    : skipped.stream().map(ProjectState::id).collect(Collectors.joining(", "));
                return "skipped from " + from + " to " + target + " (skipped: " + stages + ")";
            }
        };
        ProgressChange committed = commit(change);
        if (!committed.skipped.isEmpty() && effective.forceSkipRequired()) {
            log.warn("Project {} force-skipped {} -> {} over {}", projectId, committed.previous, target,
                committed.skipped);
        }
        return new SkipResult(committed.transition(), committed.skipped);
    }

    /**
     * 복구 간선을 따라 이전 단계로 되돌림.
     *
     * @throws InvalidTransitionException 복구 간선이 없는 경우
     */
    public TransitionResult recoverTo(ProjectId projectId, ProjectState target, String reason) {
        requireTarget(target);
        String recoveryReason = reason;
        ProgressChange change = new ProgressChange(projectId, target) {
            @Override
            void validate(ProjectState from) {
                if (!graph.canRecoverTo(from, target)) {
                    throw InvalidTransitionException.invalidRecovery(from, target, graph.recoveryOptions(from))
                        .withProject(projectId.getValue());
                }
                this.reason = recoveryReason;
            }

            @Override
            String describe(ProjectState from) {
                String base = "recovered from " + from + " to " + target;
                return reason == null || reason.isBlank() ? base : base + " (" + reason + ")";
            }
        };
        return commit(change).transition();
    }

    // ==================== 내부 구현 ====================

    private ProgressChange commit(ProgressChange change) {
        store.computeSection(change.projectId, SectionName.PROGRESS, change, null);
        log.info("Project {}: {}", change.projectId, change.description);
        return change;
    }

    private ObjectNode progressValue(ProjectState state, ProjectState previous, long at) {
        ObjectNode value = Jsons.objectNode();
        value.put("state", state.id());
        if (previous == null) {
            value.putNull("previousState");
        } else {
            value.put("previousState", previous.id());
        }
        value.put("transitionedAt", at);
        return value;
    }

    private static ProjectState stateOf(ProjectId projectId, JsonNode progress) {
        JsonNode state = progress.path("state");
        if (!state.isTextual()) {
            throw new StateValidationException("Progress of " + projectId + " has no state field",
                Map.of("projectId", projectId.getValue()));
        }
        try {
            return ProjectState.fromId(state.asText());
        } catch (IllegalArgumentException e) {
            throw new StateValidationException("Progress of " + projectId + " has unknown state: " + state.asText(),
                Map.of("projectId", projectId.getValue(), "state", state.asText()));
        }
    }

    private static void requireTarget(ProjectState target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    /**
     * progress 섹션 읽기-검증-기록을 한 번에 수행하는 mutator.
     *
     * <p>인스턴스는 한 번의 computeSection에만 사용됩니다.</p>
     */
    private abstract class ProgressChange implements SectionMutator {
        final ProjectId projectId;
        final ProjectState target;
        ProjectState previous;
        List<ProjectState> skipped = List.of();
        String reason;
        String description;
        long transitionedAt;

        ProgressChange(ProjectId projectId, ProjectState target) {
            if (projectId == null) {
                throw new IllegalArgumentException("projectId cannot be null");
            }
            this.projectId = projectId;
            this.target = target;
        }

        abstract void validate(ProjectState from);

        abstract String describe(ProjectState from);

        @Override
        public JsonNode apply(Optional<SectionSnapshot> current) {
            SectionSnapshot snapshot = current
                .orElseThrow(() -> new SectionNotFoundException(projectId, SectionName.PROGRESS));
            ProjectState from = stateOf(projectId, snapshot.value());
            validate(from);

            previous = from;
            transitionedAt = clock.millis();
            description = describe(from);
            ObjectNode value = progressValue(target, from, transitionedAt);
            if (!skipped.isEmpty()) {
                ArrayNode stages = value.putArray("skippedStages");
                skipped.forEach(stage -> stages.add(stage.id()));
            }
            if (reason != null && !reason.isBlank()) {
                value.put("reason", reason);
            }
            return value;
        }

        @Override
        public String describe(Optional<SectionSnapshot> current, JsonNode newValue, String ignored) {
            return description;
        }

        TransitionResult transition() {
            return new TransitionResult(previous, target, transitionedAt);
        }
    }
}
