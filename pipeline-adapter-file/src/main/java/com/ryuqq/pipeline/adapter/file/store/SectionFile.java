package com.ryuqq.pipeline.adapter.file.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.pipeline.core.model.HistoryEntry;

import java.util.List;

/**
 * 섹션 파일({@code <section>.json})의 영속 형식.
 *
 * <p>값, 버전, 이력을 한 파일에 담아 한 번의 rename으로 함께 커밋합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
record SectionFile(
    String projectId,
    String section,
    long version,
    long updatedAt,
    JsonNode value,
    List<HistoryEntry> history
) {

    SectionFile {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
