package com.ryuqq.pipeline.adapter.runner;

/**
 * StaleLockReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 30000ms = 30초)</li>
 *   <li>batchSize: 한 번에 처리할 잠금 수 (기본 50)</li>
 *   <li>strategy: 처리 전략 (기본 RECLAIM)</li>
 * </ul>
 *
 * <p>staleness 기준은 잠금 관리자의 heartbeatTimeoutMs를 따릅니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param strategy 처리 전략 (null이 아니어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    int batchSize,
    ReclaimStrategy strategy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=30000ms, batchSize=50, strategy=RECLAIM</p>
     */
    public ReaperConfig() {
        this(30_000, 50, ReclaimStrategy.RECLAIM);
    }

    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, batchSize, strategy);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, batchSize, strategy);
    }

    public ReaperConfig withStrategy(ReclaimStrategy strategy) {
        return new ReaperConfig(scanIntervalMs, batchSize, strategy);
    }
}
