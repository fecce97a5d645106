package com.ryuqq.pipeline.adapter.file.store;

/**
 * 프로젝트 레코드({@code _project.json})의 영속 형식.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
record ProjectFile(String projectId, String name, long createdAt) {
}
