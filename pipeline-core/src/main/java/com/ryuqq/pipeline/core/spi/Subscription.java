package com.ryuqq.pipeline.core.spi;

/**
 * Handle of a registered {@link ChangeListener}.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * Stops delivery to the listener. Idempotent.
     */
    void unsubscribe();

    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
