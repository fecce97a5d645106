package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;

/**
 * 이력 조회 또는 복원 실패 (STATE-006).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class HistoryException extends PipelineStateException {

    public HistoryException(ProjectId projectId, SectionName section, String message) {
        super(ErrorCode.HISTORY_ERROR, message, context("projectId", projectId, "section", section));
    }
}
