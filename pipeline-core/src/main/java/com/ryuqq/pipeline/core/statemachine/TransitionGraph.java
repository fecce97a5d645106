package com.ryuqq.pipeline.core.statemachine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.pipeline.core.statemachine.ProjectState.*;

/**
 * 파이프라인 상태 간 방향 그래프.
 *
 * <p>각 상태에 {@link TransitionRule}을 하나씩 대응시킵니다. 그래프에 정의된 간선만 허용되며,
 * 종료 상태(MERGED, CANCELLED)는 나가는 간선이 없습니다.</p>
 *
 * <p><strong>표준 그래프 ({@link #standard()}):</strong></p>
 * <pre>
 * collecting      → clarifying, prd_drafting
 * clarifying      → collecting, prd_drafting
 * prd_drafting    → prd_approved, collecting
 * prd_approved    → srs_drafting, prd_drafting
 * srs_drafting    → srs_approved, prd_approved
 * srs_approved    → sds_drafting, srs_drafting
 * sds_drafting    → sds_approved, srs_approved
 * sds_approved    → issues_creating, sds_drafting
 * issues_creating → issues_created, sds_approved
 * issues_created  → implementing, issues_creating
 * implementing    → pr_review, issues_created
 * pr_review       → merged, implementing
 * (모든 비종료 상태 → cancelled)
 * </pre>
 *
 * <p>정상 간선 외에 복구(recovery) 간선과 건너뛰기(skip) 간선을 따로 둡니다.
 * 이 간선들은 {@code transition}이 아니라 전용 연산으로만 사용됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class TransitionGraph {

    private static final TransitionGraph STANDARD = buildStandard();

    private final Map<ProjectState, TransitionRule> rules;

    private TransitionGraph(Map<ProjectState, TransitionRule> rules) {
        EnumMap<ProjectState, TransitionRule> copy = new EnumMap<>(ProjectState.class);
        for (ProjectState state : ProjectState.values()) {
            TransitionRule rule = rules.get(state);
            if (rule == null) {
                throw new IllegalArgumentException("Missing transition rule for state: " + state);
            }
            if (state.isTerminal() && !(rule.normal().isEmpty() && rule.recovery().isEmpty() && rule.skipTo().isEmpty())) {
                throw new IllegalArgumentException("Terminal state cannot have outgoing edges: " + state);
            }
            copy.put(state, rule);
        }
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * 표준 파이프라인 그래프.
     *
     * @return 불변 그래프
     */
    public static TransitionGraph standard() {
        return STANDARD;
    }

    /**
     * 규칙 맵으로 그래프 생성.
     *
     * @param rules 상태별 규칙 (모든 상태 포함)
     * @return 그래프
     * @throws IllegalArgumentException 규칙이 누락되었거나 종료 상태에 간선이 있는 경우
     */
    public static TransitionGraph of(Map<ProjectState, TransitionRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        return new TransitionGraph(rules);
    }

    /**
     * 상태의 전이 규칙 조회.
     */
    public TransitionRule ruleFor(ProjectState state) {
        requireState(state, "state");
        return rules.get(state);
    }

    /**
     * 정상 전이 간선 존재 여부.
     */
    public boolean isValidTransition(ProjectState from, ProjectState to) {
        requireState(from, "from");
        requireState(to, "to");
        return rules.get(from).normal().contains(to);
    }

    /**
     * 정상 전이 대상 집합.
     *
     * @param from 현재 상태
     * @return 불변 집합 (종료 상태이면 빈 집합)
     */
    public Set<ProjectState> validTransitions(ProjectState from) {
        requireState(from, "from");
        Set<ProjectState> targets = rules.get(from).normal();
        return targets.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(targets));
    }

    public boolean canRecoverTo(ProjectState from, ProjectState to) {
        requireState(from, "from");
        requireState(to, "to");
        return rules.get(from).recovery().contains(to);
    }

    public Set<ProjectState> recoveryOptions(ProjectState from) {
        requireState(from, "from");
        return rules.get(from).recovery();
    }

    public boolean canSkipTo(ProjectState from, ProjectState to) {
        requireState(from, "from");
        requireState(to, "to");
        return rules.get(from).skipTo().contains(to);
    }

    public Set<ProjectState> skipOptions(ProjectState from) {
        requireState(from, "from");
        return rules.get(from).skipTo();
    }

    public boolean isStageRequired(ProjectState state) {
        return ruleFor(state).required();
    }

    /**
     * 정규 단계 목록에서 두 상태 사이(양 끝 제외)의 단계.
     *
     * @return 사이 단계 목록, 역방향이거나 목록 밖 상태이면 빈 목록
     */
    public List<ProjectState> stagesBetween(ProjectState from, ProjectState to) {
        requireState(from, "from");
        requireState(to, "to");
        int fromIdx = from.stageIndex();
        int toIdx = to.stageIndex();
        if (fromIdx < 0 || toIdx < 0 || fromIdx >= toIdx) {
            return List.of();
        }
        return List.copyOf(ProjectState.canonicalStages().subList(fromIdx + 1, toIdx));
    }

    /**
     * 건너뛰면서 지나치게 되는 필수 단계.
     */
    public List<ProjectState> requiredStagesBetween(ProjectState from, ProjectState to) {
        List<ProjectState> required = new ArrayList<>();
        for (ProjectState stage : stagesBetween(from, to)) {
            if (isStageRequired(stage)) {
                required.add(stage);
            }
        }
        return List.copyOf(required);
    }

    private static void requireState(ProjectState state, String name) {
        if (state == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static TransitionGraph buildStandard() {
        Map<ProjectState, TransitionRule> rules = new EnumMap<>(ProjectState.class);
        rules.put(COLLECTING, rule(Set.of(CLARIFYING, PRD_DRAFTING), Set.of(), Set.of(PRD_DRAFTING), true));
        rules.put(CLARIFYING, rule(Set.of(COLLECTING, PRD_DRAFTING), Set.of(COLLECTING), Set.of(), false));
        rules.put(PRD_DRAFTING, rule(Set.of(PRD_APPROVED, COLLECTING), Set.of(COLLECTING, CLARIFYING), Set.of(), true));
        rules.put(PRD_APPROVED, rule(Set.of(SRS_DRAFTING, PRD_DRAFTING), Set.of(PRD_DRAFTING, CLARIFYING), Set.of(SDS_DRAFTING), true));
        rules.put(SRS_DRAFTING, rule(Set.of(SRS_APPROVED, PRD_APPROVED), Set.of(PRD_APPROVED, PRD_DRAFTING), Set.of(SDS_DRAFTING), false));
        rules.put(SRS_APPROVED, rule(Set.of(SDS_DRAFTING, SRS_DRAFTING), Set.of(SRS_DRAFTING, PRD_APPROVED), Set.of(ISSUES_CREATING), false));
        rules.put(SDS_DRAFTING, rule(Set.of(SDS_APPROVED, SRS_APPROVED), Set.of(SRS_APPROVED, SRS_DRAFTING), Set.of(ISSUES_CREATING), false));
        rules.put(SDS_APPROVED, rule(Set.of(ISSUES_CREATING, SDS_DRAFTING), Set.of(SDS_DRAFTING, SRS_APPROVED), Set.of(), false));
        rules.put(ISSUES_CREATING, rule(Set.of(ISSUES_CREATED, SDS_APPROVED), Set.of(SDS_APPROVED, SRS_APPROVED), Set.of(), true));
        rules.put(ISSUES_CREATED, rule(Set.of(IMPLEMENTING, ISSUES_CREATING), Set.of(ISSUES_CREATING, SDS_APPROVED), Set.of(), true));
        rules.put(IMPLEMENTING, rule(Set.of(PR_REVIEW, ISSUES_CREATED), Set.of(ISSUES_CREATED, ISSUES_CREATING), Set.of(), true));
        rules.put(PR_REVIEW, rule(Set.of(MERGED, IMPLEMENTING), Set.of(IMPLEMENTING, ISSUES_CREATED), Set.of(), true));
        rules.put(MERGED, TransitionRule.terminal(true));
        rules.put(CANCELLED, TransitionRule.terminal(false));
        return new TransitionGraph(rules);
    }

    // 모든 비종료 상태는 cancelled로 나가는 간선을 가짐
    private static TransitionRule rule(Set<ProjectState> forward, Set<ProjectState> recovery,
                                       Set<ProjectState> skipTo, boolean required) {
        EnumSet<ProjectState> normal = EnumSet.copyOf(forward);
        normal.add(CANCELLED);
        return new TransitionRule(normal, recovery, skipTo, required);
    }
}
