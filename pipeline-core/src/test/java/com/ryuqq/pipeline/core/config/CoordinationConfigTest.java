package com.ryuqq.pipeline.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinationConfigTest {

    @Test
    void defaults_MatchDocumentedValues() {
        // when
        CoordinationConfig config = CoordinationConfig.defaults(Paths.get("/tmp/state"));

        // then
        assertThat(config.basePath()).isEqualTo(Paths.get("/tmp/state"));
        assertThat(config.lockTimeoutMs()).isEqualTo(5000L);
        assertThat(config.lockRetryAttempts()).isEqualTo(10);
        assertThat(config.lockRetryDelayMs()).isEqualTo(100L);
        assertThat(config.lockMaxRetryDelayMs()).isEqualTo(5000L);
        assertThat(config.heartbeatIntervalMs()).isEqualTo(1000L);
        assertThat(config.heartbeatTimeoutMs()).isEqualTo(5000L);
        assertThat(config.maxHistoryEntries()).isEqualTo(50);
        assertThat(config.staleLockPolicy()).isEqualTo(StaleLockPolicy.COOPERATIVE_THEN_FORCE);
        assertThat(config.cooperativeReleaseTimeoutMs()).isEqualTo(1000L);
    }

    @Test
    void noArgConstructor_UsesDefaultBasePath() {
        assertThat(new CoordinationConfig().basePath()).isEqualTo(Paths.get(".pipeline/state"));
    }

    @Test
    void fromProperties_OverridesGivenKeysOnly() {
        // given
        Properties properties = new Properties();
        properties.setProperty("pipeline.state.base-path", "/var/pipeline");
        properties.setProperty("pipeline.state.max-history-entries", "10");
        properties.setProperty("pipeline.state.stale-lock-policy", "force-takeover");

        // when
        CoordinationConfig config = CoordinationConfig.fromProperties(properties);

        // then
        assertThat(config.basePath()).isEqualTo(Paths.get("/var/pipeline"));
        assertThat(config.maxHistoryEntries()).isEqualTo(10);
        assertThat(config.staleLockPolicy()).isEqualTo(StaleLockPolicy.FORCE_TAKEOVER);
        assertThat(config.lockTimeoutMs()).isEqualTo(5000L);
    }

    @Test
    void fromProperties_MalformedNumber_ThrowsException() {
        Properties properties = new Properties();
        properties.setProperty("pipeline.state.lock-timeout-ms", "five");

        assertThatThrownBy(() -> CoordinationConfig.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pipeline.state.lock-timeout-ms");
    }

    @Test
    void fromProperties_IntValueOutOfRange_ThrowsException() {
        Properties history = new Properties();
        history.setProperty("pipeline.state.max-history-entries", "4294967297");
        Properties attempts = new Properties();
        attempts.setProperty("pipeline.state.lock-retry-attempts", "2147483648");

        assertThatThrownBy(() -> CoordinationConfig.fromProperties(history))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pipeline.state.max-history-entries");
        assertThatThrownBy(() -> CoordinationConfig.fromProperties(attempts))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pipeline.state.lock-retry-attempts");
    }

    @Test
    void withMethods_ReturnModifiedCopies() {
        CoordinationConfig base = new CoordinationConfig();

        CoordinationConfig modified = base.withLockTimeoutMs(200).withHeartbeat(50, 300).withMaxHistoryEntries(3);

        assertThat(modified.lockTimeoutMs()).isEqualTo(200L);
        assertThat(modified.heartbeatIntervalMs()).isEqualTo(50L);
        assertThat(modified.heartbeatTimeoutMs()).isEqualTo(300L);
        assertThat(modified.maxHistoryEntries()).isEqualTo(3);
        assertThat(base.lockTimeoutMs()).isEqualTo(5000L);
    }

    @Test
    void constructor_InvalidValues_ThrowException() {
        CoordinationConfig base = new CoordinationConfig();

        assertThatThrownBy(() -> base.withLockTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lockTimeoutMs must be positive (current: 0)");
        assertThatThrownBy(() -> base.withHeartbeat(5000, 5000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("heartbeatIntervalMs must be < heartbeatTimeoutMs");
        assertThatThrownBy(() -> base.withBasePath(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
