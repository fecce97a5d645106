package com.ryuqq.pipeline.adapter.file.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.adapter.file.io.AtomicFileWriter;
import com.ryuqq.pipeline.core.config.CoordinationConfig;
import com.ryuqq.pipeline.core.config.StaleLockPolicy;
import com.ryuqq.pipeline.core.error.LockAcquisitionException;
import com.ryuqq.pipeline.core.error.LockLostException;
import com.ryuqq.pipeline.core.error.StorageException;
import com.ryuqq.pipeline.core.json.Jsons;
import com.ryuqq.pipeline.core.model.LockRecord;
import com.ryuqq.pipeline.core.retry.BackoffCalculator;
import com.ryuqq.pipeline.core.spi.LockAcquisition;
import com.ryuqq.pipeline.core.spi.LockManager;
import com.ryuqq.pipeline.core.spi.LockRelease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 파일 기반 잠금 관리자.
 *
 * <p>리소스 {@code X}의 잠금은 같은 디렉터리의 {@code X.lock} 파일(JSON {@link LockRecord})입니다.
 * 여러 프로세스가 같은 basePath를 공유하면 이 파일만으로 상호 배제가 이루어집니다.</p>
 *
 * <p><strong>획득:</strong></p>
 * <pre>
 * 1. 같은 인스턴스 내 스레드는 리소스별 공정 세마포어로 먼저 직렬화
 * 2. 고유 임시 파일에 레코드를 쓰고 X.lock으로 하드 링크 (존재하면 실패하는 원자적 생성)
 *    하드 링크를 지원하지 않으면 CREATE_NEW로 대체
 * 3. 이미 있으면: stale이면 탈취 시도, 아니면 백오프 후 재시도
 * 4. lockRetryAttempts 소진 또는 timeout 도달 시 TIMED_OUT (마지막 시도는 마감 시각에 수행)
 * </pre>
 *
 * <p><strong>Stale 탈취:</strong></p>
 * <ul>
 *   <li>{@code X.lock.steal} 가드 파일을 만든 한 명만 탈취 가능 (가드도 heartbeatTimeout이 지나면 stale)</li>
 *   <li>COOPERATIVE_THEN_FORCE: {@code X.lock.release}에 요청자를 남기고 보유자가 놓기를 기다린 뒤 교체</li>
 *   <li>교체된 레코드는 generation이 1 증가</li>
 * </ul>
 *
 * <p><strong>하트비트:</strong> 데몬 스케줄러가 heartbeatIntervalMs마다 보유 잠금을 갱신합니다.
 * 갱신 실패, 다른 보유자 발견, 해제 요청 수신 시 잠금을 잃은 것으로 표시하며
 * {@link #assertHeld(Path, String)}와 {@link #renew(Path, String)}가 이를 보고합니다.</p>
 *
 * <p><strong>한계:</strong> 프로세스 간 시계 차이가 heartbeatTimeoutMs에 가까우면
 * 살아 있는 잠금이 stale로 오판될 수 있습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class FileLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);

    static final String LOCK_SUFFIX = ".lock";
    static final String STEAL_SUFFIX = ".lock.steal";
    static final String RELEASE_SUFFIX = ".lock.release";
    private static final String REMOVED_SUFFIX = ".removed";

    private static final String UNKNOWN_HOLDER = "unknown";
    private static final long COOPERATIVE_POLL_MS = 25;

    private final CoordinationConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final BackoffCalculator backoff;
    private final Map<Path, Semaphore> gates = new ConcurrentHashMap<>();
    private final Map<Path, HeldLock> held = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeat;
    private volatile boolean closed;

    public FileLockManager(CoordinationConfig config) {
        this(config, Clock.systemUTC());
    }

    public FileLockManager(CoordinationConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.mapper = Jsons.mapper();
        this.backoff = new BackoffCalculator(config.lockRetryDelayMs(), config.lockMaxRetryDelayMs(), 0.1);
        this.heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-lock-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        this.heartbeat.scheduleAtFixedRate(this::heartbeatAll,
            config.heartbeatIntervalMs(), config.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
    }

    // ==================== 획득 / 해제 ====================

    @Override
    public LockAcquisition acquire(Path resource, String holderId, long timeoutMs) {
        Path key = normalize(resource);
        requireHolder(holderId);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (closed) {
            throw new LockAcquisitionException(key.toString(), "Lock manager is closed", null);
        }

        HeldLock existing = held.get(key);
        if (existing != null && existing.holderId.equals(holderId)) {
            if (existing.lostReason == null) {
                log.debug("Lock on {} already held by {}", key, holderId);
                return LockAcquisition.GRANTED;
            }
            // 잃은 잠금은 로컬 게이트를 먼저 반납
            if (held.remove(key, existing)) {
                gates.get(key).release();
            }
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Semaphore gate = gates.computeIfAbsent(key, k -> new Semaphore(1, true));
        try {
            if (!gate.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.debug("Timed out waiting for in-process gate on {}", key);
                return LockAcquisition.TIMED_OUT;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key.toString(), "Interrupted while waiting for lock on " + key, e);
        }

        boolean granted = false;
        try {
            for (int attempt = 1; ; attempt++) {
                Optional<LockRecord> record = tryAcquireOnce(key, holderId);
                if (record.isPresent()) {
                    held.put(key, new HeldLock(holderId, record.get()));
                    granted = true;
                    log.debug("Acquired lock on {} for {} (attempt {})", key, holderId, attempt);
                    return LockAcquisition.GRANTED;
                }
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (attempt >= config.lockRetryAttempts() || remainingMs <= 0) {
                    log.debug("Lock on {} not acquired by {} after {} attempt(s)", key, holderId, attempt);
                    return LockAcquisition.TIMED_OUT;
                }
                Thread.sleep(Math.min(backoff.calculate(attempt), remainingMs));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key.toString(), "Interrupted while waiting for lock on " + key, e);
        } finally {
            if (!granted) {
                gate.release();
            }
        }
    }

    @Override
    public LockRelease release(Path resource, String holderId) {
        Path key = normalize(resource);
        requireHolder(holderId);

        HeldLock local = held.get(key);
        if (local != null && local.holderId.equals(holderId)) {
            if (held.remove(key, local)) {
                gates.get(key).release();
            }
            boolean deleted = deleteIfOwned(key, holderId, local.record.generation());
            log.debug("Released lock on {} for {} (record deleted: {})", key, holderId, deleted);
            return deleted ? LockRelease.RELEASED : LockRelease.NOT_HOLDER;
        }

        // 다른 인스턴스에서 획득했지만 같은 보유자 ID인 경우 파일 기준으로 해제
        Optional<LockRecord> current = readRecord(key);
        if (current.isPresent() && current.get().isHeldBy(holderId)
                && deleteIfOwned(key, holderId, current.get().generation())) {
            log.debug("Released lock on {} for {} from file record", key, holderId);
            return LockRelease.RELEASED;
        }
        return LockRelease.NOT_HOLDER;
    }

    // ==================== 갱신 / 검증 ====================

    @Override
    public void renew(Path resource, String holderId) {
        Path key = normalize(resource);
        requireHolder(holderId);
        HeldLock local = held.get(key);
        if (local != null && local.holderId.equals(holderId)) {
            if (local.lostReason != null) {
                throw new LockLostException(key.toString(), holderId, local.lostReason);
            }
            renewHeld(key, local);
            if (local.lostReason != null) {
                throw new LockLostException(key.toString(), holderId, local.lostReason);
            }
            return;
        }
        LockRecord current = readRecord(key)
            .orElseThrow(() -> new LockLostException(key.toString(), holderId, "lock record is missing"));
        if (!current.isHeldBy(holderId)) {
            throw new LockLostException(key.toString(), holderId, "lock is held by " + current.holderId());
        }
        writeRecord(key, current.renewed(clock.millis(), config.heartbeatTimeoutMs()));
    }

    @Override
    public void assertHeld(Path resource, String holderId) {
        Path key = normalize(resource);
        requireHolder(holderId);
        HeldLock local = held.get(key);
        if (local != null && local.holderId.equals(holderId) && local.lostReason != null) {
            throw new LockLostException(key.toString(), holderId, local.lostReason);
        }
        LockRecord current = readRecord(key)
            .orElseThrow(() -> new LockLostException(key.toString(), holderId, "lock record is missing"));
        if (!current.isHeldBy(holderId)) {
            throw new LockLostException(key.toString(), holderId, "lock is held by " + current.holderId());
        }
        if (local != null && local.holderId.equals(holderId)
                && current.generation() != local.record.generation()) {
            throw new LockLostException(key.toString(), holderId,
                "lock generation changed to " + current.generation());
        }
    }

    @Override
    public boolean isStale(Path resource) {
        Path key = normalize(resource);
        return readRecord(key)
            .map(record -> record.isStale(clock.millis(), config.heartbeatTimeoutMs()))
            .orElse(false);
    }

    @Override
    public Optional<LockRecord> inspect(Path resource) {
        return readRecord(normalize(resource));
    }

    // ==================== Reaper 지원 ====================

    @Override
    public List<Path> findStaleLocks(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        Path base = config.basePath().toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        List<Path> lockFiles;
        try (Stream<Path> files = Files.walk(base, 3)) {
            lockFiles = files
                .filter(path -> path.getFileName().toString().endsWith(LOCK_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw StorageException.io(base, "scan lock files in", e);
        }

        List<Path> stale = new ArrayList<>();
        long now = clock.millis();
        for (Path lockFile : lockFiles) {
            if (stale.size() >= limit) {
                break;
            }
            Path resource = resourceOf(lockFile);
            Optional<LockRecord> record = readRecord(resource);
            if (record.isPresent() && record.get().isStale(now, config.heartbeatTimeoutMs())) {
                stale.add(resource);
            }
        }
        return stale;
    }

    @Override
    public boolean breakStaleLock(Path resource) {
        Path key = normalize(resource);
        Path guard = sibling(key, STEAL_SUFFIX);
        if (!tryCreateGuard(guard)) {
            return false;
        }
        try {
            Optional<LockRecord> record = readRecord(key);
            if (record.isEmpty() || !record.get().isStale(clock.millis(), config.heartbeatTimeoutMs())) {
                return false;
            }
            if (!removeIfUnchanged(key, record.get())) {
                return false;
            }
            deleteQuietly(sibling(key, RELEASE_SUFFIX));
            log.info("Broke stale lock on {} held by {} (generation {})",
                key, record.get().holderId(), record.get().generation());
            return true;
        } finally {
            deleteQuietly(guard);
        }
    }

    /**
     * 하트비트를 멈추고 이 인스턴스가 보유한 모든 잠금을 해제.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        heartbeat.shutdownNow();
        for (Map.Entry<Path, HeldLock> entry : new ArrayList<>(held.entrySet())) {
            try {
                release(entry.getKey(), entry.getValue().holderId);
            } catch (RuntimeException e) {
                log.warn("Failed to release lock on {} while closing", entry.getKey(), e);
            }
        }
    }

    /**
     * 이 인스턴스가 현재 보유 중인 잠금 수.
     */
    public int heldCount() {
        return held.size();
    }

    // ==================== 내부 구현 ====================

    private Optional<LockRecord> tryAcquireOnce(Path key, String holderId) {
        LockRecord fresh = LockRecord.acquired(key.toString(), holderId, clock.millis(), config.heartbeatTimeoutMs());
        if (tryCreate(key, fresh)) {
            return Optional.of(fresh);
        }
        Optional<LockRecord> current = readRecord(key);
        if (current.isEmpty()) {
            // 확인 사이에 해제됨
            return tryCreate(key, fresh) ? Optional.of(fresh) : Optional.empty();
        }
        if (current.get().isStale(clock.millis(), config.heartbeatTimeoutMs())) {
            return takeOver(key, current.get(), holderId);
        }
        return Optional.empty();
    }

    private boolean tryCreate(Path key, LockRecord record) {
        Path lockFile = lockFile(key);
        byte[] content = serialize(record);
        Path temp = null;
        try {
            temp = AtomicFileWriter.writeTemp(lockFile, content);
            Files.createLink(lockFile, temp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (UnsupportedOperationException | FileSystemException e) {
            log.debug("Hard link unavailable for {}, falling back to exclusive create: {}", lockFile, e.getMessage());
            return createExclusive(lockFile, content);
        } catch (IOException e) {
            throw StorageException.io(lockFile, "create lock", e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private boolean createExclusive(Path lockFile, byte[] content) {
        try {
            Files.write(lockFile, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
                StandardOpenOption.SYNC);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw StorageException.io(lockFile, "create lock", e);
        }
    }

    private Optional<LockRecord> takeOver(Path key, LockRecord observed, String holderId) {
        Path guard = sibling(key, STEAL_SUFFIX);
        if (!tryCreateGuard(guard)) {
            return Optional.empty();
        }
        try {
            Optional<LockRecord> current = readRecord(key);
            if (current.isEmpty()) {
                return createSuccessor(key, observed, holderId);
            }
            if (!current.get().isStale(clock.millis(), config.heartbeatTimeoutMs())) {
                return Optional.empty();
            }
            LockRecord stale = current.get();

            if (config.staleLockPolicy() == StaleLockPolicy.COOPERATIVE_THEN_FORCE) {
                Optional<LockRecord> afterWait = awaitCooperativeRelease(key, stale, holderId);
                if (afterWait.isEmpty()) {
                    log.info("Stale lock on {} released cooperatively by {}", key, stale.holderId());
                    return createSuccessor(key, stale, holderId);
                }
                if (!sameRecord(afterWait.get(), stale)) {
                    log.debug("Lock on {} changed hands while waiting for cooperative release", key);
                    return Optional.empty();
                }
            }

            // 덮어쓰지 않고 제거 후 생성
            if (!removeIfUnchanged(key, stale)) {
                return Optional.empty();
            }
            Optional<LockRecord> replacement = createSuccessor(key, stale, holderId);
            replacement.ifPresent(record -> log.info("Took over stale lock on {} from {} (generation {} -> {})",
                key, stale.holderId(), stale.generation(), record.generation()));
            return replacement;
        } finally {
            deleteQuietly(sibling(key, RELEASE_SUFFIX));
            deleteQuietly(guard);
        }
    }

    private Optional<LockRecord> createSuccessor(Path key, LockRecord previous, String holderId) {
        LockRecord successor = previous.takenOverBy(holderId, clock.millis(), config.heartbeatTimeoutMs());
        return tryCreate(key, successor) ? Optional.of(successor) : Optional.empty();
    }

    /**
     * 해제 요청을 남기고 오래된 레코드가 사라지거나 바뀔 때까지 대기.
     *
     * <p>요청 파일에는 요청자와 대상 보유자, 세대를 줄 단위로 기록합니다.
     * 대상이 아닌 보유자는 요청을 무시합니다.</p>
     *
     * @return 대기가 끝난 시점의 레코드, 잠금 파일이 없으면 empty
     */
    private Optional<LockRecord> awaitCooperativeRelease(Path key, LockRecord stale, String requester) {
        Path request = sibling(key, RELEASE_SUFFIX);
        String content = requester + "\n" + stale.holderId() + "\n" + stale.generation();
        try {
            Files.write(request, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw StorageException.io(request, "write release request", e);
        }
        log.debug("Requested cooperative release of {} from {}", key, stale.holderId());

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.cooperativeReleaseTimeoutMs());
        while (System.nanoTime() < deadline) {
            Optional<LockRecord> current = readRecord(key);
            if (current.isEmpty() || !sameRecord(current.get(), stale)) {
                return current;
            }
            try {
                Thread.sleep(COOPERATIVE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException(key.toString(),
                    "Interrupted while waiting for cooperative release of " + key, e);
            }
        }
        return readRecord(key);
    }

    /**
     * 잠금 파일이 기대한 레코드 그대로일 때만 제거.
     *
     * <p>파일을 고유한 이름으로 원자적으로 옮긴 뒤 내용을 확인하므로, 읽은 뒤 다른 보유자가
     * 새로 만든 잠금을 지우지 않습니다. 옮긴 파일이 기대와 다르면 원래 자리로 되돌립니다.</p>
     *
     * @return 기대한 레코드를 제거했으면 true
     */
    private boolean removeIfUnchanged(Path key, LockRecord expected) {
        Path lockFile = lockFile(key);
        Path detached = lockFile.resolveSibling(lockFile.getFileName() + "." + UUID.randomUUID() + REMOVED_SUFFIX);
        try {
            Files.move(lockFile, detached, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw StorageException.io(lockFile, "detach stale lock", e);
        }
        try {
            Optional<LockRecord> removed = readRecordFile(detached, key);
            if (removed.isPresent() && sameRecord(removed.get(), expected)) {
                return true;
            }
            restoreDetached(lockFile, detached);
            return false;
        } finally {
            deleteQuietly(detached);
        }
    }

    private void restoreDetached(Path lockFile, Path detached) {
        try {
            Files.createLink(lockFile, detached);
        } catch (FileAlreadyExistsException e) {
            log.warn("Could not restore lock {}: a newer lock was created meanwhile", lockFile);
        } catch (UnsupportedOperationException | FileSystemException e) {
            try {
                createExclusive(lockFile, Files.readAllBytes(detached));
            } catch (IOException readFailure) {
                throw StorageException.io(detached, "restore lock", readFailure);
            }
        } catch (IOException e) {
            throw StorageException.io(lockFile, "restore lock", e);
        }
    }

    private static boolean sameRecord(LockRecord a, LockRecord b) {
        return a.holderId().equals(b.holderId())
            && a.generation() == b.generation()
            && a.lastHeartbeat() == b.lastHeartbeat();
    }

    private boolean tryCreateGuard(Path guard) {
        try {
            Files.createFile(guard);
            return true;
        } catch (FileAlreadyExistsException e) {
            expireStaleGuard(guard);
            return false;
        } catch (IOException e) {
            throw StorageException.io(guard, "create takeover guard", e);
        }
    }

    // 가드를 만든 프로세스가 죽었으면 가드도 결국 만료됨
    private void expireStaleGuard(Path guard) {
        try {
            long modified = Files.getLastModifiedTime(guard).toMillis();
            if (clock.millis() - modified > config.heartbeatTimeoutMs()) {
                Files.deleteIfExists(guard);
                log.warn("Removed abandoned takeover guard {}", guard);
            }
        } catch (NoSuchFileException e) {
            log.trace("Takeover guard {} already removed", guard);
        } catch (IOException e) {
            throw StorageException.io(guard, "inspect takeover guard", e);
        }
    }

    private boolean deleteIfOwned(Path key, String holderId, long generation) {
        Optional<LockRecord> current = readRecord(key);
        if (current.isEmpty() || !current.get().isHeldBy(holderId) || current.get().generation() != generation) {
            return false;
        }
        try {
            Files.deleteIfExists(lockFile(key));
            return true;
        } catch (IOException e) {
            throw StorageException.io(lockFile(key), "delete lock", e);
        }
    }

    private void heartbeatAll() {
        for (Map.Entry<Path, HeldLock> entry : held.entrySet()) {
            HeldLock lock = entry.getValue();
            if (lock.lostReason != null) {
                continue;
            }
            try {
                renewHeld(entry.getKey(), lock);
            } catch (RuntimeException e) {
                lock.lostReason = "heartbeat failed: " + e.getMessage();
                log.warn("Heartbeat failed for lock on {} held by {}", entry.getKey(), lock.holderId, e);
            }
        }
    }

    private void renewHeld(Path key, HeldLock lock) {
        Path request = sibling(key, RELEASE_SUFFIX);
        if (isFreshRequest(request)) {
            List<String> lines = readRequest(request);
            String requester = lines.isEmpty() ? "" : lines.get(0);
            if (!lock.holderId.equals(requester) && isRequestFor(lines, lock)) {
                lock.lostReason = "release requested by " + requester;
                deleteIfOwned(key, lock.holderId, lock.record.generation());
                log.warn("Gave up lock on {} held by {}: release requested by {}", key, lock.holderId, requester);
                return;
            }
        }

        Path guard = sibling(key, STEAL_SUFFIX);
        if (!tryCreateGuard(guard)) {
            // 탈취 진행 중, 결과는 다음 주기에 확인
            return;
        }
        try {
            Optional<LockRecord> current = readRecord(key);
            if (current.isEmpty() || !current.get().isHeldBy(lock.holderId)
                    || current.get().generation() != lock.record.generation()) {
                lock.lostReason = current.map(r -> "lock is held by " + r.holderId()).orElse("lock record is missing");
                log.warn("Lost lock on {} held by {}: {}", key, lock.holderId, lock.lostReason);
                return;
            }
            LockRecord renewed = current.get().renewed(clock.millis(), config.heartbeatTimeoutMs());
            writeRecord(key, renewed);
            lock.record = renewed;
        } finally {
            deleteQuietly(guard);
        }
    }

    // 탈취자가 죽어 남은 오래된 요청은 무시
    private boolean isFreshRequest(Path request) {
        try {
            long modified = Files.getLastModifiedTime(request).toMillis();
            return clock.millis() - modified <= config.heartbeatTimeoutMs();
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw StorageException.io(request, "inspect release request", e);
        }
    }

    private List<String> readRequest(Path request) {
        try {
            return new String(Files.readAllBytes(request), StandardCharsets.UTF_8).lines()
                .map(String::trim)
                .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw StorageException.io(request, "read release request", e);
        }
    }

    // 대상이 적히지 않은 요청은 현재 보유자에게 향한 것으로 간주
    private static boolean isRequestFor(List<String> lines, HeldLock lock) {
        if (lines.size() < 3) {
            return true;
        }
        return lines.get(1).equals(lock.holderId)
            && lines.get(2).equals(Long.toString(lock.record.generation()));
    }

    Optional<LockRecord> readRecord(Path key) {
        return readRecordFile(lockFile(key), key);
    }

    private Optional<LockRecord> readRecordFile(Path lockFile, Path key) {
        byte[] content;
        try {
            content = Files.readAllBytes(lockFile);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.io(lockFile, "read lock", e);
        }
        if (content.length > 0) {
            try {
                return Optional.of(mapper.readValue(content, LockRecord.class));
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Unreadable lock record {}, using file timestamp: {}", lockFile, e.getMessage());
            }
        }
        // 쓰는 중이거나 손상된 레코드는 파일 수정 시각을 하트비트로 간주
        try {
            long modified = Files.getLastModifiedTime(lockFile).toMillis();
            return Optional.of(new LockRecord(key.toString(), UNKNOWN_HOLDER, modified, modified, null, 0L));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.io(lockFile, "stat lock", e);
        }
    }

    private void writeRecord(Path key, LockRecord record) {
        Path lockFile = lockFile(key);
        try {
            AtomicFileWriter.write(lockFile, serialize(record));
        } catch (IOException e) {
            throw StorageException.io(lockFile, "write lock", e);
        }
    }

    private byte[] serialize(LockRecord record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lock record for " + record.resource(), e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}", path, e);
        }
    }

    private static Path normalize(Path resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        return resource.toAbsolutePath().normalize();
    }

    private static void requireHolder(String holderId) {
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId cannot be null or blank");
        }
    }

    static Path lockFile(Path resource) {
        return sibling(resource, LOCK_SUFFIX);
    }

    private static Path sibling(Path resource, String suffix) {
        return resource.resolveSibling(resource.getFileName().toString() + suffix);
    }

    private static Path resourceOf(Path lockFile) {
        String name = lockFile.getFileName().toString();
        return lockFile.resolveSibling(name.substring(0, name.length() - LOCK_SUFFIX.length()));
    }

    private static final class HeldLock {
        private final String holderId;
        private volatile LockRecord record;
        private volatile String lostReason;

        private HeldLock(String holderId, LockRecord record) {
            this.holderId = holderId;
            this.record = record;
        }
    }
}
