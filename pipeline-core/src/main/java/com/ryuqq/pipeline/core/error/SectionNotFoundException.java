package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;

/**
 * 섹션이 한 번도 기록되지 않음 (STATE-002).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class SectionNotFoundException extends PipelineStateException {

    private final ProjectId projectId;
    private final SectionName section;

    public SectionNotFoundException(ProjectId projectId, SectionName section) {
        super(ErrorCode.SECTION_NOT_FOUND,
            "Section not found: " + projectId + "/" + section,
            context("projectId", projectId, "section", section));
        this.projectId = projectId;
        this.section = section;
    }

    public ProjectId getProjectId() {
        return projectId;
    }

    public SectionName getSection() {
        return section;
    }
}
