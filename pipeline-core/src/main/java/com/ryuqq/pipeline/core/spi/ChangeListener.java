package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.model.StateChangeEvent;

/**
 * Receives committed state changes in the publishing process.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ChangeListener {

    void onChange(StateChangeEvent event);
}
