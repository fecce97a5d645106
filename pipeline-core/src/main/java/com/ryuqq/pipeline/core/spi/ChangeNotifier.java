package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.StateChangeEvent;

/**
 * In-process change notification SPI.
 *
 * <p>Delivers committed changes to listeners in the same process only. Observers in other
 * processes poll {@link StateStore#version(ProjectId, SectionName)} instead.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>A failing listener must not affect other listeners or the publishing write</li>
 *   <li>Subscribing after {@link #close()} fails with
 *       {@link com.ryuqq.pipeline.core.error.WatchException}</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface ChangeNotifier extends AutoCloseable {

    /**
     * Registers a listener.
     *
     * @param projectId project to observe
     * @param section section to observe, or null for every section of the project
     * @param listener callback
     * @return subscription handle
     */
    Subscription subscribe(ProjectId projectId, SectionName section, ChangeListener listener);

    void publish(StateChangeEvent event);

    /**
     * Drops every subscription of the project.
     */
    void unsubscribeProject(ProjectId projectId);

    int subscriberCount();

    @Override
    void close();
}
