package com.ryuqq.pipeline.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Section 이력의 단일 항목.
 *
 * <p>쓰기 한 번마다 하나의 항목이 추가되며, 해당 시점 값의 전체 스냅샷을 보관합니다.
 * Section별 최대 개수를 넘으면 가장 오래된 항목부터 제거됩니다.</p>
 *
 * @param sequence Section 내 추가 순번 (1부터 단조 증가)
 * @param timestamp 기록 시각 (epoch 밀리초)
 * @param version 이 항목이 기록한 Section 버전
 * @param snapshot 쓰기 직후의 Section 값
 * @param description 변경 설명 (선택, null 가능)
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record HistoryEntry(
    long sequence,
    long timestamp,
    long version,
    JsonNode snapshot,
    String description
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public HistoryEntry {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        // description은 null 허용
    }
}
