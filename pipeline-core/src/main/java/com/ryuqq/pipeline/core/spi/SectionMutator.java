package com.ryuqq.pipeline.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.pipeline.core.model.SectionSnapshot;

import java.util.Optional;

/**
 * Read-modify-write function applied under the section lock.
 *
 * <p>Receives the current snapshot (empty when the section was never written) and returns
 * the new value. Throwing aborts the write; nothing is committed.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SectionMutator {

    /**
     * @param current current section snapshot including history
     * @return new section value (must not be null)
     */
    JsonNode apply(Optional<SectionSnapshot> current);

    /**
     * History description of the committed value.
     *
     * <p>Called after {@link #apply} with the value about to be committed, for mutators whose
     * description depends on what they read under the lock.</p>
     *
     * @param current snapshot passed to {@link #apply}
     * @param newValue value returned by {@link #apply}
     * @param description description given to the store
     * @return description to record (may be null)
     */
    default String describe(Optional<SectionSnapshot> current, JsonNode newValue, String description) {
        return description;
    }
}
