package com.ryuqq.pipeline.core.model;

/**
 * 프로젝트 등록 정보.
 *
 * <p>프로젝트 존재 여부는 이 레코드의 존재로 판단합니다.</p>
 *
 * @param projectId 프로젝트 ID
 * @param name 프로젝트 이름
 * @param createdAt 생성 시각 (epoch 밀리초)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ProjectRecord(
    ProjectId projectId,
    String name,
    long createdAt
) {

    public ProjectRecord {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
