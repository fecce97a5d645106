package com.ryuqq.pipeline.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockRecordTest {

    @Test
    void acquired_SetsHeartbeatAndExpiry() {
        // when
        LockRecord record = LockRecord.acquired("/tmp/a.json", "holder-1", 1_000L, 5_000L);

        // then
        assertThat(record.acquiredAt()).isEqualTo(1_000L);
        assertThat(record.lastHeartbeat()).isEqualTo(1_000L);
        assertThat(record.expiresAt()).isEqualTo(6_000L);
        assertThat(record.generation()).isZero();
        assertThat(record.isHeldBy("holder-1")).isTrue();
        assertThat(record.isHeldBy("holder-2")).isFalse();
    }

    @Test
    void isStale_OnlyAfterTimeoutElapsed() {
        // given
        LockRecord record = LockRecord.acquired("/tmp/a.json", "holder-1", 1_000L, 5_000L);

        // then
        assertThat(record.isStale(6_000L, 5_000L)).isFalse();
        assertThat(record.isStale(6_001L, 5_000L)).isTrue();
    }

    @Test
    void renewed_KeepsAcquiredAtAndGeneration() {
        // given
        LockRecord record = LockRecord.acquired("/tmp/a.json", "holder-1", 1_000L, 5_000L);

        // when
        LockRecord renewed = record.renewed(3_000L, 5_000L);

        // then
        assertThat(renewed.acquiredAt()).isEqualTo(1_000L);
        assertThat(renewed.lastHeartbeat()).isEqualTo(3_000L);
        assertThat(renewed.generation()).isZero();
        assertThat(renewed.isStale(7_000L, 5_000L)).isFalse();
    }

    @Test
    void takenOverBy_BumpsGeneration() {
        // given
        LockRecord record = LockRecord.acquired("/tmp/a.json", "holder-1", 1_000L, 5_000L);

        // when
        LockRecord taken = record.takenOverBy("holder-2", 10_000L, 5_000L);

        // then
        assertThat(taken.holderId()).isEqualTo("holder-2");
        assertThat(taken.generation()).isEqualTo(1L);
        assertThat(taken.acquiredAt()).isEqualTo(10_000L);
    }

    @Test
    void constructor_BlankHolder_ThrowsException() {
        assertThatThrownBy(() -> new LockRecord("/tmp/a.json", " ", 0, 0, null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("holderId");
    }
}
