package com.ryuqq.pipeline.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 커밋된 Section 쓰기에 대한 프로세스 내 알림.
 *
 * <p>다른 프로세스의 쓰기는 이 이벤트로 전달되지 않습니다.
 * 프로세스 간 관찰자는 Section 버전을 폴링해야 합니다.</p>
 *
 * @param projectId 프로젝트 ID
 * @param section Section 이름
 * @param previousValue 이전 값 (CREATE이면 null)
 * @param newValue 새 값 (DELETE이면 null)
 * @param version 커밋된 버전 (DELETE이면 마지막 버전)
 * @param changeType 변경 종류
 * @param timestamp 이벤트 시각 (epoch 밀리초)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record StateChangeEvent(
    ProjectId projectId,
    SectionName section,
    JsonNode previousValue,
    JsonNode newValue,
    long version,
    ChangeType changeType,
    long timestamp
) {

    public StateChangeEvent {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (section == null) {
            throw new IllegalArgumentException("section cannot be null");
        }
        if (changeType == null) {
            throw new IllegalArgumentException("changeType cannot be null");
        }
    }
}
