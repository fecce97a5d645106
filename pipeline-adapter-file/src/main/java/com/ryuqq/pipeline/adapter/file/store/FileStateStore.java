package com.ryuqq.pipeline.adapter.file.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.pipeline.adapter.file.io.AtomicFileWriter;
import com.ryuqq.pipeline.core.config.CoordinationConfig;
import com.ryuqq.pipeline.core.error.HistoryException;
import com.ryuqq.pipeline.core.error.LockAcquisitionException;
import com.ryuqq.pipeline.core.error.ProjectAlreadyExistsException;
import com.ryuqq.pipeline.core.error.ProjectNotFoundException;
import com.ryuqq.pipeline.core.error.SectionNotFoundException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.error.StorageException;
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
import com.ryuqq.pipeline.core.spi.LockManager;
import com.ryuqq.pipeline.core.spi.SectionMutator;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.spi.noop.NoOpChangeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 파일 기반 버전 관리 상태 저장소.
 *
 * <p><strong>디렉터리 구조:</strong></p>
 * <pre>
 * &lt;basePath&gt;/&lt;projectId&gt;/_project.json          프로젝트 레코드
 * &lt;basePath&gt;/&lt;projectId&gt;/&lt;section&gt;.json         {projectId, section, version, updatedAt, value, history[]}
 * &lt;basePath&gt;/&lt;projectId&gt;/&lt;section&gt;.json.lock    쓰기 잠금
 * &lt;basePath&gt;/&lt;projectId&gt;/_project.json.lock     생성/삭제 잠금
 * </pre>
 *
 * <p><strong>쓰기 절차 (섹션 단위로 전순서):</strong></p>
 * <pre>
 * 1. 섹션 파일 잠금 획득 (쓰기마다 고유한 holderId)
 * 2. 현재 파일 읽기 → 변경 함수 적용
 * 3. version + 1, 이력 추가 (maxHistoryEntries 초과 시 가장 오래된 것부터 제거)
 * 4. 잠금 보유 재확인 후 임시 파일 + fsync + ATOMIC_MOVE
 * 5. 잠금 해제 → 같은 프로세스의 구독자에게 이벤트 전달
 * </pre>
 *
 * <p>읽기는 잠금 없이 수행하며 원자적 rename 덕분에 부분 기록을 보지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    static final String PROJECT_FILE = "_project.json";
    static final String SECTION_EXTENSION = ".json";

    private final CoordinationConfig config;
    private final LockManager lockManager;
    private final ChangeNotifier notifier;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Path basePath;
    private final String processTag;

    public FileStateStore(CoordinationConfig config, LockManager lockManager) {
        this(config, lockManager, new NoOpChangeNotifier(), Clock.systemUTC());
    }

    public FileStateStore(CoordinationConfig config, LockManager lockManager, ChangeNotifier notifier) {
        this(config, lockManager, notifier, Clock.systemUTC());
    }

    public FileStateStore(CoordinationConfig config, LockManager lockManager, ChangeNotifier notifier, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (lockManager == null) {
            throw new IllegalArgumentException("lockManager cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.lockManager = lockManager;
        this.notifier = notifier;
        this.clock = clock;
        this.mapper = Jsons.mapper();
        this.basePath = config.basePath().toAbsolutePath().normalize();
        this.processTag = String.valueOf(ProcessHandle.current().pid());
    }

    // ==================== 프로젝트 ====================

    @Override
    public ProjectRecord createProject(ProjectId projectId, String name) {
        requireProjectId(projectId);
        Path projectFile = projectFile(projectId);
        ProjectFile created = withLock(projectFile, () -> {
            if (Files.exists(projectFile)) {
                throw new ProjectAlreadyExistsException(projectId);
            }
            String displayName = name == null || name.isBlank() ? projectId.getValue() : name;
            ProjectFile record = new ProjectFile(projectId.getValue(), displayName, clock.millis());
            writeAtomically(projectFile, record);
            return record;
        });
        log.info("Created project {} at {}", projectId, projectFile.getParent());
        return toRecord(created);
    }

    @Override
    public boolean projectExists(ProjectId projectId) {
        requireProjectId(projectId);
        return Files.isRegularFile(projectFile(projectId));
    }

    @Override
    public ProjectRecord getProject(ProjectId projectId) {
        requireProjectId(projectId);
        return readJson(projectFile(projectId), ProjectFile.class)
            .map(FileStateStore::toRecord)
            .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    /**
     * 프로젝트 삭제.
     *
     * <p>프로젝트 레코드를 먼저 지워 이후의 쓰기가 실패하게 한 뒤, 섹션마다 잠금을 잡고
     * 파일을 지웁니다. 섹션별 DELETE 이벤트를 발행하고 구독을 모두 해제합니다.</p>
     */
    @Override
    public List<SectionName> deleteProject(ProjectId projectId) {
        requireProjectId(projectId);
        Path projectFile = projectFile(projectId);
        withLock(projectFile, () -> {
            if (!Files.exists(projectFile)) {
                throw new ProjectNotFoundException(projectId);
            }
            deleteFile(projectFile);
            return null;
        });

        List<SectionName> sections = scanSections(projectId);
        List<StateChangeEvent> events = new ArrayList<>();
        for (SectionName section : sections) {
            Path sectionFile = sectionFile(projectId, section);
            Optional<SectionFile> removed = withLock(sectionFile, () -> {
                Optional<SectionFile> current = readJson(sectionFile, SectionFile.class);
                deleteFile(sectionFile);
                return current;
            });
            removed.ifPresent(file -> events.add(new StateChangeEvent(projectId, section, file.value(), null,
                file.version(), ChangeType.DELETE, clock.millis())));
        }
        removeDirectoryIfEmpty(projectDir(projectId));
        log.info("Deleted project {} ({} section(s))", projectId, sections.size());

        events.forEach(notifier::publish);
        notifier.unsubscribeProject(projectId);
        return sections;
    }

    @Override
    public List<ProjectId> listProjects() {
        if (!Files.isDirectory(basePath)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(basePath)) {
            return dirs
                .filter(dir -> Files.isRegularFile(dir.resolve(PROJECT_FILE)))
                .map(dir -> dir.getFileName().toString())
                .sorted()
                .map(ProjectId::of)
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw StorageException.io(basePath, "list projects in", e);
        }
    }

    @Override
    public List<SectionName> listSections(ProjectId projectId) {
        requireProject(projectId);
        return scanSections(projectId);
    }

    // ==================== 섹션 읽기 ====================

    @Override
    public Optional<SectionSnapshot> readSection(ProjectId projectId, SectionName section, ReadOptions options) {
        requireSection(section);
        ReadOptions effective = options == null ? ReadOptions.defaults() : options;
        requireProject(projectId);
        Optional<SectionFile> file = readJson(sectionFile(projectId, section), SectionFile.class);
        if (file.isEmpty()) {
            if (effective.allowMissing()) {
                return Optional.empty();
            }
            throw new SectionNotFoundException(projectId, section);
        }
        SectionSnapshot snapshot = toSnapshot(projectId, section, file.get());
        return Optional.of(effective.includeHistory() ? snapshot : snapshot.withoutHistory());
    }

    @Override
    public List<HistoryEntry> getHistory(ProjectId projectId, SectionName section) {
        requireSection(section);
        requireProject(projectId);
        return readJson(sectionFile(projectId, section), SectionFile.class)
            .map(SectionFile::history)
            .orElse(List.of());
    }

    @Override
    public long version(ProjectId projectId, SectionName section) {
        requireSection(section);
        requireProject(projectId);
        return readJson(sectionFile(projectId, section), SectionFile.class)
            .map(SectionFile::version)
            .orElse(0L);
    }

    // ==================== 섹션 쓰기 ====================

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
        return computeSection(projectId, section, current -> mergeShallow(current, (ObjectNode) patch),
            effective.description());
    }

    @Override
    public SectionSnapshot computeSection(ProjectId projectId, SectionName section, SectionMutator mutator,
                                          String description) {
        requireSection(section);
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        requireProject(projectId);

        Path file = sectionFile(projectId, section);
        String holderId = newHolderId();
        acquire(file, holderId);

        StateChangeEvent event;
        SectionFile committed;
        try {
            if (!projectExists(projectId)) {
                throw new ProjectNotFoundException(projectId);
            }
            Optional<SectionFile> current = readJson(file, SectionFile.class);
            Optional<SectionSnapshot> currentSnapshot = current.map(f -> toSnapshot(projectId, section, f));
            JsonNode newValue = mutator.apply(currentSnapshot);
            if (newValue == null) {
                throw new StateValidationException("Section mutator returned null for " + projectId + "/" + section);
            }

            long now = clock.millis();
            long version = current.map(SectionFile::version).orElse(0L) + 1;
            List<HistoryEntry> history = new ArrayList<>(current.map(SectionFile::history).orElse(List.of()));
            String recorded = mutator.describe(currentSnapshot, newValue, description);
            history.add(new HistoryEntry(version, now, version, newValue.deepCopy(), recorded));
            int overflow = history.size() - config.maxHistoryEntries();
            if (overflow > 0) {
                history.subList(0, overflow).clear();
            }

            committed = new SectionFile(projectId.getValue(), section.getValue(), version, now, newValue, history);
            byte[] content = serialize(committed, file);
            lockManager.assertHeld(file, holderId);
            try {
                AtomicFileWriter.write(file, content);
            } catch (IOException e) {
                throw StorageException.io(file, "write section", e);
            }
            event = new StateChangeEvent(projectId, section,
                current.map(SectionFile::value).orElse(null), newValue, version,
                current.isPresent() ? ChangeType.UPDATE : ChangeType.CREATE, now);
        } finally {
            releaseAfterUse(file, holderId);
        }

        log.debug("Committed {}/{} version {}", projectId, section, committed.version());
        notifier.publish(event);
        return toSnapshot(projectId, section, committed).withoutHistory();
    }

    @Override
    public SectionSnapshot restoreFromHistory(ProjectId projectId, SectionName section, long sequence) {
        return computeSection(projectId, section, current -> {
            SectionSnapshot snapshot = current.orElseThrow(() ->
                new HistoryException(projectId, section, "No history for " + projectId + "/" + section));
            return snapshot.history().stream()
                .filter(entry -> entry.sequence() == sequence)
                .findFirst()
                .map(HistoryEntry::snapshot)
                .<JsonNode>map(JsonNode::deepCopy)
                .orElseThrow(() -> new HistoryException(projectId, section,
                    "History entry " + sequence + " not found for " + projectId + "/" + section));
        }, "restored from sequence " + sequence);
    }

    // ==================== 내부 구현 ====================

    private static JsonNode mergeShallow(Optional<SectionSnapshot> current, ObjectNode patch) {
        ObjectNode merged = current
            .map(SectionSnapshot::value)
            .filter(JsonNode::isObject)
            .map(value -> ((ObjectNode) value).deepCopy())
            .orElseGet(Jsons::objectNode);
        merged.setAll(patch.deepCopy());
        return merged;
    }

    private <T> T withLock(Path resource, Supplier<T> action) {
        String holderId = newHolderId();
        acquire(resource, holderId);
        try {
            T result = action.get();
            lockManager.assertHeld(resource, holderId);
            return result;
        } finally {
            releaseAfterUse(resource, holderId);
        }
    }

    // 커밋은 이미 끝났으므로 해제 실패는 전파하지 않음, 남은 잠금은 하트비트가 끊겨 stale 처리됨
    private void releaseAfterUse(Path resource, String holderId) {
        try {
            lockManager.release(resource, holderId);
        } catch (RuntimeException e) {
            log.warn("Failed to release lock on {} held by {}, it will expire as stale", resource, holderId, e);
        }
    }

    private void acquire(Path resource, String holderId) {
        if (!lockManager.acquire(resource, holderId, config.lockTimeoutMs()).isGranted()) {
            throw new LockAcquisitionException(resource.toString(), config.lockTimeoutMs());
        }
    }

    private String newHolderId() {
        return processTag + ":" + UUID.randomUUID();
    }

    private List<SectionName> scanSections(ProjectId projectId) {
        Path dir = projectDir(projectId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            List<SectionName> sections = new ArrayList<>();
            files.map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SECTION_EXTENSION) && !name.startsWith("_") && !name.startsWith("."))
                .map(name -> name.substring(0, name.length() - SECTION_EXTENSION.length()))
                .sorted()
                .forEach(name -> {
                    try {
                        sections.add(SectionName.of(name));
                    } catch (IllegalArgumentException e) {
                        log.debug("Ignoring non-section file {} in {}: {}", name, dir, e.getMessage());
                    }
                });
            return sections;
        } catch (IOException e) {
            throw StorageException.io(dir, "list sections in", e);
        }
    }

    private <T> Optional<T> readJson(Path file, Class<T> type) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.io(file, "read", e);
        }
        try {
            return Optional.of(mapper.readValue(content, type));
        } catch (IOException e) {
            throw StorageException.corrupt(file, e);
        }
    }

    private void writeAtomically(Path file, Object record) {
        byte[] content = serialize(record, file);
        try {
            AtomicFileWriter.write(file, content);
        } catch (IOException e) {
            throw StorageException.io(file, "write", e);
        }
    }

    private byte[] serialize(Object record, Path file) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new StateValidationException("Value for " + file.getFileName() + " is not serializable: "
                + e.getOriginalMessage());
        }
    }

    private static void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw StorageException.io(file, "delete", e);
        }
    }

    // 동시에 다른 섹션 잠금 파일이 남아 있으면 디렉터리는 유지
    private static void removeDirectoryIfEmpty(Path dir) {
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Project directory {} still has lock files, leaving it in place", dir);
        } catch (IOException e) {
            throw StorageException.io(dir, "delete project directory", e);
        }
    }

    private void requireProject(ProjectId projectId) {
        if (!projectExists(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
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

    private Path projectDir(ProjectId projectId) {
        return basePath.resolve(projectId.getValue());
    }

    private Path projectFile(ProjectId projectId) {
        return projectDir(projectId).resolve(PROJECT_FILE);
    }

    private Path sectionFile(ProjectId projectId, SectionName section) {
        return projectDir(projectId).resolve(section.getValue() + SECTION_EXTENSION);
    }

    private static ProjectRecord toRecord(ProjectFile file) {
        return new ProjectRecord(ProjectId.of(file.projectId()), file.name(), file.createdAt());
    }

    private static SectionSnapshot toSnapshot(ProjectId projectId, SectionName section, SectionFile file) {
        return new SectionSnapshot(projectId, section, file.value(), file.version(), file.updatedAt(), file.history());
    }
}
