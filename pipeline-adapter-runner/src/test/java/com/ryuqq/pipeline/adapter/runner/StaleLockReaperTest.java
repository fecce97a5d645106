package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.error.StorageException;
import com.ryuqq.pipeline.core.model.LockRecord;
import com.ryuqq.pipeline.core.spi.LockManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StaleLockReaper 유닛 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StaleLockReaperTest {

    private static final Path INFO = Path.of("/state/001/info.json");
    private static final Path ISSUES = Path.of("/state/001/issues.json");
    private static final Path PROGRESS = Path.of("/state/002/progress.json");

    @Mock
    private LockManager lockManager;

    private StaleLockReaper reaper;
    private ReaperConfig config;

    @BeforeEach
    void setUp() {
        config = new ReaperConfig();
        reaper = new StaleLockReaper(lockManager, config);
    }

    // ============================================================
    // 1. RECLAIM 전략
    // ============================================================

    @Test
    void scan_RECLAIM_전략이면_stale_잠금을_모두_회수함() {
        // given
        when(lockManager.findStaleLocks(50)).thenReturn(List.of(INFO, ISSUES));
        when(lockManager.breakStaleLock(INFO)).thenReturn(true);
        when(lockManager.breakStaleLock(ISSUES)).thenReturn(true);

        // when
        int handled = reaper.scan();

        // then
        assertThat(handled).isEqualTo(2);
        verify(lockManager).breakStaleLock(INFO);
        verify(lockManager).breakStaleLock(ISSUES);
    }

    @Test
    void scan_재확인_시_더_이상_stale이_아니면_건너뜀() {
        // given
        when(lockManager.findStaleLocks(50)).thenReturn(List.of(INFO, ISSUES));
        when(lockManager.breakStaleLock(INFO)).thenReturn(false);
        when(lockManager.breakStaleLock(ISSUES)).thenReturn(true);

        // when
        int handled = reaper.scan();

        // then
        assertThat(handled).isEqualTo(1);
    }

    @Test
    void scan_개별_항목_예외가_발생해도_나머지는_계속_처리() {
        // given
        when(lockManager.findStaleLocks(50)).thenReturn(List.of(INFO, ISSUES, PROGRESS));
        when(lockManager.breakStaleLock(INFO)).thenReturn(true);
        when(lockManager.breakStaleLock(ISSUES))
            .thenThrow(StorageException.io(ISSUES, "delete lock", new IOException("Permission denied")));
        when(lockManager.breakStaleLock(PROGRESS)).thenReturn(true);

        // when
        int handled = reaper.scan();

        // then
        assertThat(handled).isEqualTo(2);
        verify(lockManager).breakStaleLock(PROGRESS);
    }

    @Test
    void scan_stale_잠금이_없으면_0_반환() {
        // given
        when(lockManager.findStaleLocks(50)).thenReturn(List.of());

        // when & then
        assertThat(reaper.scan()).isZero();
        verify(lockManager, never()).breakStaleLock(any());
    }

    @Test
    void scan_batchSize만큼만_조회함() {
        // given
        reaper = new StaleLockReaper(lockManager, config.withBatchSize(2));
        when(lockManager.findStaleLocks(2)).thenReturn(List.of());

        // when
        reaper.scan();

        // then
        verify(lockManager).findStaleLocks(2);
    }

    // ============================================================
    // 2. REPORT 전략
    // ============================================================

    @Test
    void scan_REPORT_전략이면_회수하지_않고_보고만_함() {
        // given
        reaper = new StaleLockReaper(lockManager, config.withStrategy(ReclaimStrategy.REPORT));
        when(lockManager.findStaleLocks(50)).thenReturn(List.of(INFO));
        when(lockManager.inspect(INFO))
            .thenReturn(Optional.of(LockRecord.acquired(INFO.toString(), "dead-process", 0L, 5_000L)));

        // when
        int handled = reaper.scan();

        // then
        assertThat(handled).isEqualTo(1);
        verify(lockManager, never()).breakStaleLock(any());
    }

    // ============================================================
    // 3. 스케줄 / 설정
    // ============================================================

    @Test
    void schedule_scanIntervalMs_주기로_등록() {
        // given
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);

        // when
        reaper.schedule(scheduler);

        // then
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(30_000L), eq(30_000L),
            eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void config_유효하지_않은_값은_예외() {
        assertThatThrownBy(() -> new ReaperConfig(0, 50, ReclaimStrategy.RECLAIM))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scanIntervalMs must be positive");
        assertThatThrownBy(() -> config.withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withStrategy(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("strategy cannot be null");
        assertThatThrownBy(() -> new StaleLockReaper(null, config))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
