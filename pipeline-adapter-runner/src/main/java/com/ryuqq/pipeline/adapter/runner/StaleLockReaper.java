package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.spi.LockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Stale 잠금 회수 컴포넌트.
 *
 * <p>하트비트가 끊긴 프로세스가 남긴 잠금 파일을 찾아 처리합니다.</p>
 *
 * <p><strong>회수 시나리오:</strong></p>
 * <pre>
 * 1. 프로세스 A가 info.json 잠금 획득
 * 2. 프로세스 A 비정상 종료 → 하트비트 중단
 * 3. heartbeatTimeoutMs 경과 → 잠금 레코드 stale
 * 4. Reaper 주기적 스캔 (예: 30초마다)
 * 5. 처리 전략 적용:
 *    - RECLAIM: breakStaleLock(resource)
 *    - REPORT: WARN 로그만 기록
 * </pre>
 *
 * <p>개별 잠금 처리 중 예외가 발생해도 나머지 항목은 계속 처리합니다.
 * 여러 프로세스에서 동시에 실행해도 됩니다 (회수는 takeover guard로 직렬화됨).</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class StaleLockReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleLockReaper.class);
    private final LockManager lockManager;
    private final ReaperConfig config;

    /**
     * 생성자.
     *
     * @param lockManager 잠금 관리자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StaleLockReaper(LockManager lockManager, ReaperConfig config) {
        if (lockManager == null) {
            throw new IllegalArgumentException("lockManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.lockManager = lockManager;
        this.config = config;
    }

    /**
     * Stale 잠금 스캔 및 처리.
     *
     * @return 처리한 잠금 수 (RECLAIM: 삭제 수, REPORT: 보고 수)
     */
    public int scan() {
        List<Path> stale = lockManager.findStaleLocks(config.batchSize());
        if (stale.isEmpty()) {
            log.debug("Reaper scan found no stale locks");
            return 0;
        }

        int handled = 0;
        for (Path resource : stale) {
            if (tryHandle(resource)) {
                handled++;
            }
        }

        log.info("Reaper scan completed: {} handled out of {} stale ({})", handled, stale.size(), config.strategy());
        return handled;
    }

    /**
     * 주기 스캔 등록.
     *
     * <p>스캔 예외는 로그로 남기고 다음 주기를 유지합니다.</p>
     *
     * @param scheduler 스케줄러
     * @return 등록된 작업 (취소용)
     */
    public ScheduledFuture<?> schedule(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler.scheduleWithFixedDelay(() -> {
            try {
                scan();
            } catch (RuntimeException e) {
                log.error("Reaper scan failed", e);
            }
        }, config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private boolean tryHandle(Path resource) {
        try {
            switch (config.strategy()) {
                case RECLAIM:
                    if (lockManager.breakStaleLock(resource)) {
                        log.info("Reaper reclaimed stale lock on {}", resource);
                        return true;
                    }
                    log.debug("Lock on {} is no longer stale, skipping", resource);
                    return false;
                case REPORT:
                    log.warn("Stale lock on {}: {}", resource, lockManager.inspect(resource).orElse(null));
                    return true;
                default:
                    throw new IllegalStateException("Unknown strategy: " + config.strategy());
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle stale lock on {} in Reaper scan", resource, e);
            return false;
        }
    }
}
