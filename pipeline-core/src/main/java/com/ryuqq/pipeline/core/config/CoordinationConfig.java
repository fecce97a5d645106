package com.ryuqq.pipeline.core.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * 상태 조정 코어 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>basePath: 상태 파일 루트 디렉터리 (기본 .pipeline/state)</li>
 *   <li>lockTimeoutMs: 잠금 획득 최대 대기 (기본 5000ms)</li>
 *   <li>lockRetryAttempts: 잠금 획득 최대 시도 횟수 (기본 10)</li>
 *   <li>lockRetryDelayMs / lockMaxRetryDelayMs: 잠금 폴링 백오프 기본값과 상한 (기본 100ms / 5000ms)</li>
 *   <li>heartbeatIntervalMs: 하트비트 갱신 주기 (기본 1000ms)</li>
 *   <li>heartbeatTimeoutMs: 이 시간 동안 갱신이 없으면 stale (기본 5000ms)</li>
 *   <li>maxHistoryEntries: 섹션당 보관 이력 수 (기본 50)</li>
 *   <li>staleLockPolicy: stale 잠금 처리 방식 (기본 COOPERATIVE_THEN_FORCE)</li>
 *   <li>cooperativeReleaseTimeoutMs: 협조적 해제 대기 (기본 1000ms)</li>
 * </ul>
 *
 * <p><strong>Properties 키 ({@link #fromProperties(Properties)}):</strong></p>
 * <pre>
 * pipeline.state.base-path
 * pipeline.state.lock-timeout-ms
 * pipeline.state.lock-retry-attempts
 * pipeline.state.lock-retry-delay-ms
 * pipeline.state.lock-max-retry-delay-ms
 * pipeline.state.heartbeat-interval-ms
 * pipeline.state.heartbeat-timeout-ms
 * pipeline.state.max-history-entries
 * pipeline.state.stale-lock-policy
 * pipeline.state.cooperative-release-timeout-ms
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 * @param basePath 상태 파일 루트 (null이 아니어야 함)
 * @param lockTimeoutMs 잠금 획득 최대 대기 (양수)
 * @param lockRetryAttempts 잠금 획득 최대 시도 횟수 (양수)
 * @param lockRetryDelayMs 잠금 폴링 기본 지연 (양수)
 * @param lockMaxRetryDelayMs 잠금 폴링 지연 상한 (lockRetryDelayMs 이상)
 * @param heartbeatIntervalMs 하트비트 주기 (양수, heartbeatTimeoutMs 미만)
 * @param heartbeatTimeoutMs stale 판정 기준 (양수)
 * @param maxHistoryEntries 섹션당 이력 상한 (양수)
 * @param staleLockPolicy stale 잠금 처리 방식 (null이 아니어야 함)
 * @param cooperativeReleaseTimeoutMs 협조적 해제 대기 (0 이상)
 */
public record CoordinationConfig(
    Path basePath,
    long lockTimeoutMs,
    int lockRetryAttempts,
    long lockRetryDelayMs,
    long lockMaxRetryDelayMs,
    long heartbeatIntervalMs,
    long heartbeatTimeoutMs,
    int maxHistoryEntries,
    StaleLockPolicy staleLockPolicy,
    long cooperativeReleaseTimeoutMs
) {

    public static final String DEFAULT_BASE_PATH = ".pipeline/state";

    private static final String PREFIX = "pipeline.state.";

    /**
     * 기본 설정 생성자 (basePath = .pipeline/state).
     */
    public CoordinationConfig() {
        this(Paths.get(DEFAULT_BASE_PATH), 5000, 10, 100, 5000, 1000, 5000, 50,
            StaleLockPolicy.COOPERATIVE_THEN_FORCE, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinationConfig {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
        requirePositive("lockTimeoutMs", lockTimeoutMs);
        requirePositive("lockRetryAttempts", lockRetryAttempts);
        requirePositive("lockRetryDelayMs", lockRetryDelayMs);
        if (lockMaxRetryDelayMs < lockRetryDelayMs) {
            throw new IllegalArgumentException(
                "lockMaxRetryDelayMs must be >= lockRetryDelayMs (base: " + lockRetryDelayMs
                    + ", max: " + lockMaxRetryDelayMs + ")"
            );
        }
        requirePositive("heartbeatIntervalMs", heartbeatIntervalMs);
        requirePositive("heartbeatTimeoutMs", heartbeatTimeoutMs);
        if (heartbeatIntervalMs >= heartbeatTimeoutMs) {
            throw new IllegalArgumentException(
                "heartbeatIntervalMs must be < heartbeatTimeoutMs (interval: " + heartbeatIntervalMs
                    + ", timeout: " + heartbeatTimeoutMs + ")"
            );
        }
        requirePositive("maxHistoryEntries", maxHistoryEntries);
        if (staleLockPolicy == null) {
            throw new IllegalArgumentException("staleLockPolicy cannot be null");
        }
        if (cooperativeReleaseTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "cooperativeReleaseTimeoutMs must be non-negative (current: " + cooperativeReleaseTimeoutMs + ")"
            );
        }
    }

    /**
     * 기본값에 basePath만 지정한 설정.
     */
    public static CoordinationConfig defaults(Path basePath) {
        return new CoordinationConfig().withBasePath(basePath);
    }

    /**
     * Properties에서 설정 생성. 없는 키는 기본값을 사용합니다.
     *
     * @throws IllegalArgumentException 값 형식이 잘못된 경우
     */
    public static CoordinationConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        CoordinationConfig d = new CoordinationConfig();
        return new CoordinationConfig(
            Paths.get(properties.getProperty(PREFIX + "base-path", d.basePath().toString())),
            longProperty(properties, "lock-timeout-ms", d.lockTimeoutMs()),
            intProperty(properties, "lock-retry-attempts", d.lockRetryAttempts()),
            longProperty(properties, "lock-retry-delay-ms", d.lockRetryDelayMs()),
            longProperty(properties, "lock-max-retry-delay-ms", d.lockMaxRetryDelayMs()),
            longProperty(properties, "heartbeat-interval-ms", d.heartbeatIntervalMs()),
            longProperty(properties, "heartbeat-timeout-ms", d.heartbeatTimeoutMs()),
            intProperty(properties, "max-history-entries", d.maxHistoryEntries()),
            policyProperty(properties, d.staleLockPolicy()),
            longProperty(properties, "cooperative-release-timeout-ms", d.cooperativeReleaseTimeoutMs())
        );
    }

    public CoordinationConfig withBasePath(Path basePath) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withLockTimeoutMs(long lockTimeoutMs) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withLockRetry(int lockRetryAttempts, long lockRetryDelayMs, long lockMaxRetryDelayMs) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withHeartbeat(long heartbeatIntervalMs, long heartbeatTimeoutMs) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withMaxHistoryEntries(int maxHistoryEntries) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withStaleLockPolicy(StaleLockPolicy staleLockPolicy) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    public CoordinationConfig withCooperativeReleaseTimeoutMs(long cooperativeReleaseTimeoutMs) {
        return new CoordinationConfig(basePath, lockTimeoutMs, lockRetryAttempts, lockRetryDelayMs,
            lockMaxRetryDelayMs, heartbeatIntervalMs, heartbeatTimeoutMs, maxHistoryEntries,
            staleLockPolicy, cooperativeReleaseTimeoutMs);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    private static long longProperty(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static StaleLockPolicy policyProperty(Properties properties, StaleLockPolicy defaultValue) {
        String raw = properties.getProperty(PREFIX + "stale-lock-policy");
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return StaleLockPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + "stale-lock-policy: " + raw, e);
        }
    }
}
