/**
 * Core domain model for shared pipeline state.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.model.ProjectId} - Project identifier</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.SectionName} - Named section of project state</li>
 * </ul>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.model.SectionSnapshot} - Section value with version and history</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.HistoryEntry} - Full snapshot of one committed write</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.LockRecord} - Advisory lock file contents</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.StateChangeEvent} - In-process change notification</li>
 * </ul>
 *
 * <p>All types are immutable and validate their arguments on construction.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.model;
