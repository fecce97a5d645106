package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.model.ProjectId;

/**
 * 프로젝트가 존재하지 않음 (STATE-001).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ProjectNotFoundException extends PipelineStateException {

    private final ProjectId projectId;

    public ProjectNotFoundException(ProjectId projectId) {
        super(ErrorCode.PROJECT_NOT_FOUND,
            "Project not found: " + projectId,
            context("projectId", projectId));
        this.projectId = projectId;
    }

    public ProjectId getProjectId() {
        return projectId;
    }
}
