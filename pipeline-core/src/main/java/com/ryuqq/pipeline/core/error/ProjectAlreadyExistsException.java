package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.model.ProjectId;

/**
 * 이미 존재하는 프로젝트 생성 시도 (STATE-003).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ProjectAlreadyExistsException extends PipelineStateException {

    private final ProjectId projectId;

    public ProjectAlreadyExistsException(ProjectId projectId) {
        super(ErrorCode.PROJECT_ALREADY_EXISTS,
            "Project already exists: " + projectId,
            context("projectId", projectId));
        this.projectId = projectId;
    }

    public ProjectId getProjectId() {
        return projectId;
    }
}
