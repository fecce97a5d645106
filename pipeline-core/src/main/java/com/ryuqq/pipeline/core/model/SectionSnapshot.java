package com.ryuqq.pipeline.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 특정 시점의 Section 읽기 결과.
 *
 * @param projectId 프로젝트 ID
 * @param section Section 이름
 * @param value 현재 값
 * @param version 현재 버전 (쓰기마다 1씩 증가)
 * @param updatedAt 마지막 쓰기 시각 (epoch 밀리초)
 * @param history 이력 (오래된 순, includeHistory 요청 시에만 채워짐)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record SectionSnapshot(
    ProjectId projectId,
    SectionName section,
    JsonNode value,
    long version,
    long updatedAt,
    List<HistoryEntry> history
) {

    public SectionSnapshot {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (section == null) {
            throw new IllegalArgumentException("section cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * 이력을 제외한 스냅샷 생성.
     */
    public SectionSnapshot withoutHistory() {
        return new SectionSnapshot(projectId, section, value, version, updatedAt, List.of());
    }
}
