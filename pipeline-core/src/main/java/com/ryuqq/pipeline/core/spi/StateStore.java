package com.ryuqq.pipeline.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ProjectRecord;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.model.UpdateOptions;

import java.util.List;
import java.util.Optional;

/**
 * Versioned State Store SPI.
 *
 * <p>Holds projects and their named sections. Every write to a section is serialized
 * against every other writer of the same section, increments the section version by one
 * and appends a full-snapshot {@link HistoryEntry}; history is bounded and evicts the
 * oldest entries first.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>No committed write is ever lost or reordered</li>
 *   <li>Readers never observe a partially written section</li>
 *   <li>Failures are raised as {@link com.ryuqq.pipeline.core.error.PipelineStateException} subtypes</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Creates a project record.
     *
     * @throws com.ryuqq.pipeline.core.error.ProjectAlreadyExistsException if it already exists
     */
    ProjectRecord createProject(ProjectId projectId, String name);

    boolean projectExists(ProjectId projectId);

    /**
     * @throws com.ryuqq.pipeline.core.error.ProjectNotFoundException if the project does not exist
     */
    ProjectRecord getProject(ProjectId projectId);

    /**
     * Deletes the project and all of its sections.
     *
     * @return the sections that existed before deletion
     * @throws com.ryuqq.pipeline.core.error.ProjectNotFoundException if the project does not exist
     */
    List<SectionName> deleteProject(ProjectId projectId);

    /**
     * @return project ids in ascending order
     */
    List<ProjectId> listProjects();

    /**
     * Lists the sections written so far.
     *
     * @throws com.ryuqq.pipeline.core.error.ProjectNotFoundException if the project does not exist
     */
    List<SectionName> listSections(ProjectId projectId);

    /**
     * Reads a section.
     *
     * @return the snapshot, or empty when missing and {@code allowMissing} is set
     * @throws com.ryuqq.pipeline.core.error.ProjectNotFoundException if the project does not exist
     * @throws com.ryuqq.pipeline.core.error.SectionNotFoundException if the section is missing
     *         and {@code allowMissing} is not set
     */
    Optional<SectionSnapshot> readSection(ProjectId projectId, SectionName section, ReadOptions options);

    /**
     * Replaces the section value.
     *
     * @param description optional history description
     * @return the committed snapshot (without history)
     */
    SectionSnapshot writeSection(ProjectId projectId, SectionName section, JsonNode value, String description);

    /**
     * Merges or replaces the section value.
     *
     * <p>With {@code merge} the object patch is shallow-merged into the current object value;
     * a missing or non-object current value is treated as an empty object.</p>
     *
     * @throws com.ryuqq.pipeline.core.error.StateValidationException if merging a non-object patch
     */
    SectionSnapshot updateSection(ProjectId projectId, SectionName section, JsonNode patch, UpdateOptions options);

    /**
     * General read-modify-write under the section lock.
     */
    SectionSnapshot computeSection(ProjectId projectId, SectionName section, SectionMutator mutator, String description);

    /**
     * @return history oldest-first, empty when the section was never written
     */
    List<HistoryEntry> getHistory(ProjectId projectId, SectionName section);

    /**
     * Current section version, the polling primitive for cross-process observers.
     *
     * @return version, or 0 when the section was never written
     */
    long version(ProjectId projectId, SectionName section);

    /**
     * Writes the snapshot of a history entry as a new version.
     *
     * @throws com.ryuqq.pipeline.core.error.HistoryException if no entry has that sequence
     */
    SectionSnapshot restoreFromHistory(ProjectId projectId, SectionName section, long sequence);
}
