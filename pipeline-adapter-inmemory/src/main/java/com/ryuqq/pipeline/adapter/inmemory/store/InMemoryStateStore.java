package com.ryuqq.pipeline.adapter.inmemory.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.pipeline.core.error.HistoryException;
import com.ryuqq.pipeline.core.error.ProjectAlreadyExistsException;
import com.ryuqq.pipeline.core.error.ProjectNotFoundException;
import com.ryuqq.pipeline.core.error.SectionNotFoundException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.json.Jsons;
import com.ryuqq.pipeline.core.model.ChangeType;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ProjectRecord;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import com.ryuqq.pipeline.core.spi.ChangeNotifier;
import com.ryuqq.pipeline.core.spi.SectionMutator;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.spi.noop.NoOpChangeNotifier;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link StateStore} SPI for testing and reference purposes.
 *
 * <p>Same observable semantics as the file-backed store (versioning, bounded history, merge
 * rules, change events) without touching the filesystem. Mutations are serialized on a single
 * monitor; events are published after the monitor is released.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>projects:</strong> ConcurrentHashMap&lt;ProjectId, ProjectEntry&gt; - project record and sections</li>
 *   <li><strong>sections:</strong> TreeMap&lt;String, SectionEntry&gt; per project - sorted by section name</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No cross-process exclusion</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    public static final int DEFAULT_MAX_HISTORY_ENTRIES = 50;

    private final ConcurrentHashMap<ProjectId, ProjectEntry> projects;
    private final int maxHistoryEntries;
    private final ChangeNotifier notifier;
    private final Clock clock;
    private final Object monitor = new Object();

    public InMemoryStateStore() {
        this(DEFAULT_MAX_HISTORY_ENTRIES, new NoOpChangeNotifier());
    }

    public InMemoryStateStore(int maxHistoryEntries, ChangeNotifier notifier) {
        this(maxHistoryEntries, notifier, Clock.systemUTC());
    }

    public InMemoryStateStore(int maxHistoryEntries, ChangeNotifier notifier, Clock clock) {
        if (maxHistoryEntries <= 0) {
            throw new IllegalArgumentException("maxHistoryEntries must be positive (current: " + maxHistoryEntries + ")");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.projects = new ConcurrentHashMap<>();
        this.maxHistoryEntries = maxHistoryEntries;
        this.notifier = notifier;
        this.clock = clock;
    }

    // ==================== 프로젝트 ====================

    @Override
    public ProjectRecord createProject(ProjectId projectId, String name) {
        requireProjectId(projectId);
        String displayName = name == null || name.isBlank() ? projectId.getValue() : name;
        ProjectRecord record = new ProjectRecord(projectId, displayName, clock.millis());
        if (projects.putIfAbsent(projectId, new ProjectEntry(record)) != null) {
            throw new ProjectAlreadyExistsException(projectId);
        }
        return record;
    }

    @Override
    public boolean projectExists(ProjectId projectId) {
        requireProjectId(projectId);
        return projects.containsKey(projectId);
    }

    @Override
    public ProjectRecord getProject(ProjectId projectId) {
        return project(projectId).record;
    }

    @Override
    public List<SectionName> deleteProject(ProjectId projectId) {
        requireProjectId(projectId);
        List<StateChangeEvent> events = new ArrayList<>();
        List<SectionName> deleted = new ArrayList<>();
        synchronized (monitor) {
            ProjectEntry removed = projects.remove(projectId);
            if (removed == null) {
                throw new ProjectNotFoundException(projectId);
            }
            long now = clock.millis();
            for (SectionEntry entry : removed.sections.values()) {
                deleted.add(entry.section);
                events.add(new StateChangeEvent(projectId, entry.section, entry.value.deepCopy(), null,
                    entry.version, ChangeType.DELETE, now));
            }
        }
        events.forEach(notifier::publish);
        notifier.unsubscribeProject(projectId);
        return deleted;
    }

    @Override
    public List<ProjectId> listProjects() {
        return projects.keySet().stream()
            .sorted(Comparator.comparing(ProjectId::getValue))
            .collect(Collectors.toList());
    }

    @Override
    public List<SectionName> listSections(ProjectId projectId) {
        ProjectEntry project = project(projectId);
        synchronized (monitor) {
            return project.sections.values().stream()
                .map(entry -> entry.section)
                .collect(Collectors.toList());
        }
    }

    // ==================== 섹션 ====================

    @Override
    public Optional<SectionSnapshot> readSection(ProjectId projectId, SectionName section, ReadOptions options) {
        requireSection(section);
        ReadOptions effective = options == null ? ReadOptions.defaults() : options;
        Optional<SectionSnapshot> snapshot = snapshot(projectId, section);
        if (snapshot.isEmpty()) {
            if (effective.allowMissing()) {
                return Optional.empty();
            }
            throw new SectionNotFoundException(projectId, section);
        }
        return effective.includeHistory() ? snapshot : snapshot.map(SectionSnapshot::withoutHistory);
    }

    @Override
    public SectionSnapshot writeSection(ProjectId projectId, SectionName section, JsonNode value, String description) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return computeSection(projectId, section, current -> value.deepCopy(), description);
    }

    @Override
    public SectionSnapshot updateSection(ProjectId projectId, SectionName section, JsonNode patch,
                                         UpdateOptions options) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        UpdateOptions effective = options == null ? UpdateOptions.defaults() : options;
        if (!effective.merge()) {
            return computeSection(projectId, section, current -> patch.deepCopy(), effective.description());
        }
        if (!patch.isObject()) {
            throw new StateValidationException(
                "Merge patch must be a JSON object (actual: " + patch.getNodeType() + ")",
                Map.of("projectId", projectId, "section", section));
        }
        return computeSection(projectId, section, current -> {
            ObjectNode merged = current
                .map(SectionSnapshot::value)
                .filter(JsonNode::isObject)
                .map(value -> ((ObjectNode) value).deepCopy())
                .orElseGet(Jsons::objectNode);
            merged.setAll(((ObjectNode) patch).deepCopy());
            return merged;
        }, effective.description());
    }

    @Override
    public SectionSnapshot computeSection(ProjectId projectId, SectionName section, SectionMutator mutator,
                                          String description) {
        requireSection(section);
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }

        StateChangeEvent event;
        SectionSnapshot committed;
        synchronized (monitor) {
            ProjectEntry project = project(projectId);
            SectionEntry current = project.sections.get(section.getValue());
            Optional<SectionSnapshot> currentSnapshot = Optional.ofNullable(current)
                .map(entry -> entry.toSnapshot(projectId));
            JsonNode newValue = mutator.apply(currentSnapshot);
            if (newValue == null) {
                throw new StateValidationException("Section mutator returned null for " + projectId + "/" + section);
            }

            long now = clock.millis();
            long version = current == null ? 1 : current.version + 1;
            List<HistoryEntry> history = new ArrayList<>(current == null ? List.of() : current.history);
            String recorded = mutator.describe(currentSnapshot, newValue, description);
            history.add(new HistoryEntry(version, now, version, newValue.deepCopy(), recorded));
            int overflow = history.size() - maxHistoryEntries;
            if (overflow > 0) {
                history.subList(0, overflow).clear();
            }

            SectionEntry next = new SectionEntry(section, newValue.deepCopy(), version, now, history);
            project.sections.put(section.getValue(), next);
            committed = next.toSnapshot(projectId).withoutHistory();
            event = new StateChangeEvent(projectId, section,
                current == null ? null : current.value.deepCopy(), newValue.deepCopy(), version,
                current == null ? ChangeType.CREATE : ChangeType.UPDATE, now);
        }
        notifier.publish(event);
        return committed;
    }

    @Override
    public List<HistoryEntry> getHistory(ProjectId projectId, SectionName section) {
        requireSection(section);
        return snapshot(projectId, section).map(SectionSnapshot::history).orElse(List.of());
    }

    @Override
    public long version(ProjectId projectId, SectionName section) {
        requireSection(section);
        return snapshot(projectId, section).map(SectionSnapshot::version).orElse(0L);
    }

    @Override
    public SectionSnapshot restoreFromHistory(ProjectId projectId, SectionName section, long sequence) {
        return computeSection(projectId, section, current -> current
            .orElseThrow(() -> new HistoryException(projectId, section, "No history for " + projectId + "/" + section))
            .history().stream()
            .filter(entry -> entry.sequence() == sequence)
            .findFirst()
            .map(HistoryEntry::snapshot)
            .<JsonNode>map(JsonNode::deepCopy)
            .orElseThrow(() -> new HistoryException(projectId, section,
                "History entry " + sequence + " not found for " + projectId + "/" + section)),
            "restored from sequence " + sequence);
    }

    /**
     * 모든 프로젝트 삭제 (테스트 정리용). 이벤트는 발행하지 않습니다.
     */
    public void clear() {
        synchronized (monitor) {
            projects.clear();
        }
    }

    // ==================== 내부 구현 ====================

    private Optional<SectionSnapshot> snapshot(ProjectId projectId, SectionName section) {
        ProjectEntry project = project(projectId);
        synchronized (monitor) {
            return Optional.ofNullable(project.sections.get(section.getValue()))
                .map(entry -> entry.toSnapshot(projectId));
        }
    }

    private ProjectEntry project(ProjectId projectId) {
        requireProjectId(projectId);
        ProjectEntry project = projects.get(projectId);
        if (project == null) {
            throw new ProjectNotFoundException(projectId);
        }
        return project;
    }

    private static void requireProjectId(ProjectId projectId) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
    }

    private static void requireSection(SectionName section) {
        if (section == null) {
            throw new IllegalArgumentException("section cannot be null");
        }
    }

    private static final class ProjectEntry {
        private final ProjectRecord record;
        private final TreeMap<String, SectionEntry> sections = new TreeMap<>();

        ProjectEntry(ProjectRecord record) {
            this.record = record;
        }
    }

    private static final class SectionEntry {
        private final SectionName section;
        private final JsonNode value;
        private final long version;
        private final long updatedAt;
        private final List<HistoryEntry> history;

        SectionEntry(SectionName section, JsonNode value, long version, long updatedAt, List<HistoryEntry> history) {
            this.section = section;
            this.value = value;
            this.version = version;
            this.updatedAt = updatedAt;
            this.history = List.copyOf(history);
        }

        // JsonNode는 가변이므로 외부에는 복사본만 전달
        SectionSnapshot toSnapshot(ProjectId projectId) {
            List<HistoryEntry> copies = history.stream()
                .map(entry -> new HistoryEntry(entry.sequence(), entry.timestamp(), entry.version(),
                    entry.snapshot().deepCopy(), entry.description()))
                .collect(Collectors.toList());
            return new SectionSnapshot(projectId, section, value.deepCopy(), version, updatedAt, copies);
        }
    }
}
