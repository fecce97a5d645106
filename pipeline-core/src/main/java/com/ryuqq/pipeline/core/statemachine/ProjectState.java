package com.ryuqq.pipeline.core.statemachine;

import java.util.List;

/**
 * 프로젝트 파이프라인 상태.
 *
 * <p><strong>정상 진행 흐름:</strong></p>
 * <pre>
 * COLLECTING
 *    │
 *    ▼
 * CLARIFYING → PRD_DRAFTING → PRD_APPROVED → SRS_DRAFTING → SRS_APPROVED
 *    → SDS_DRAFTING → SDS_APPROVED → ISSUES_CREATING → ISSUES_CREATED
 *    → IMPLEMENTING → PR_REVIEW → MERGED
 *
 * 모든 비종료 상태 → CANCELLED
 * </pre>
 *
 * <p>그래프는 전순서가 아닙니다 (되돌아가는 간선과 취소가 존재).
 * 진행률은 {@link #canonicalStages()} 목록의 위치로만 계산합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ProjectState {

    COLLECTING("collecting"),
    CLARIFYING("clarifying"),
    PRD_DRAFTING("prd_drafting"),
    PRD_APPROVED("prd_approved"),
    SRS_DRAFTING("srs_drafting"),
    SRS_APPROVED("srs_approved"),
    SDS_DRAFTING("sds_drafting"),
    SDS_APPROVED("sds_approved"),
    ISSUES_CREATING("issues_creating"),
    ISSUES_CREATED("issues_created"),
    IMPLEMENTING("implementing"),
    PR_REVIEW("pr_review"),

    /**
     * 병합 완료 (종료 상태).
     */
    MERGED("merged"),

    /**
     * 취소 (종료 상태, 모든 비종료 상태에서 도달 가능).
     */
    CANCELLED("cancelled");

    private static final List<ProjectState> CANONICAL_STAGES = List.of(
        COLLECTING, CLARIFYING, PRD_DRAFTING, PRD_APPROVED,
        SRS_DRAFTING, SRS_APPROVED, SDS_DRAFTING, SDS_APPROVED,
        ISSUES_CREATING, ISSUES_CREATED, IMPLEMENTING, PR_REVIEW, MERGED
    );

    private final String id;

    ProjectState(String id) {
        this.id = id;
    }

    /**
     * 영속 표현 (예: "prd_drafting").
     *
     * @return 상태 식별자
     */
    public String id() {
        return id;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(MERGED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return MERGED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == MERGED || this == CANCELLED;
    }

    /**
     * 식별자로 상태 조회.
     *
     * @param id 상태 식별자 (대소문자 무시, 예: "collecting")
     * @return 상태
     * @throws IllegalArgumentException 알 수 없는 식별자인 경우
     */
    public static ProjectState fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("state id cannot be null or blank");
        }
        for (ProjectState state : values()) {
            if (state.id.equalsIgnoreCase(id.trim())) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown project state: " + id);
    }

    /**
     * 진행률 계산에 쓰이는 정규 단계 목록 (CANCELLED 제외).
     *
     * @return 불변 목록
     */
    public static List<ProjectState> canonicalStages() {
        return CANONICAL_STAGES;
    }

    /**
     * 정규 단계 목록 내 위치.
     *
     * @return 0부터 시작하는 위치, CANCELLED이면 -1
     */
    public int stageIndex() {
        return CANONICAL_STAGES.indexOf(this);
    }

    @Override
    public String toString() {
        return id;
    }
}
