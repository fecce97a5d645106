package com.ryuqq.pipeline.adapter.inmemory.notifier;

import com.ryuqq.pipeline.core.error.WatchException;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.spi.ChangeListener;
import com.ryuqq.pipeline.core.spi.ChangeNotifier;
import com.ryuqq.pipeline.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of {@link ChangeNotifier} SPI.
 *
 * <p>Events are delivered synchronously on the publishing thread. Each project keeps its
 * registrations in a {@link CopyOnWriteArrayList}, so listeners are called in subscription order
 * and publishing never blocks subscribing.</p>
 *
 * <p><strong>Matching:</strong></p>
 * <ul>
 *   <li>section subscription: events of that (project, section) only</li>
 *   <li>project-wide subscription ({@code section == null}): every event of the project</li>
 * </ul>
 *
 * <p>A listener that throws is logged at WARN and skipped; remaining listeners still receive
 * the event and the publishing write is unaffected.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Single JVM only: other processes observe changes by polling the section version</li>
 *   <li>Slow listeners delay the writer that published the event</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryChangeNotifier implements ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChangeNotifier.class);

    /**
     * Registrations per project, in subscription order.
     */
    private final ConcurrentHashMap<ProjectId, CopyOnWriteArrayList<Registration>> registrations;

    private volatile boolean closed;

    public InMemoryChangeNotifier() {
        this.registrations = new ConcurrentHashMap<>();
    }

    @Override
    public Subscription subscribe(ProjectId projectId, SectionName section, ChangeListener listener) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (closed) {
            throw new WatchException("Change notifier is closed");
        }

        Registration registration = new Registration(projectId, section, listener);
        registrations.computeIfAbsent(projectId, key -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("Subscribed to {}/{}", projectId, section == null ? "*" : section);
        return registration;
    }

    /**
     * {@inheritDoc}
     *
     * <p>After {@link #close()} events are dropped.</p>
     */
    @Override
    public void publish(StateChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (closed) {
            return;
        }
        List<Registration> targets = registrations.get(event.projectId());
        if (targets == null) {
            return;
        }
        for (Registration registration : targets) {
            if (registration.matches(event)) {
                deliver(registration, event);
            }
        }
    }

    @Override
    public void unsubscribeProject(ProjectId projectId) {
        if (projectId == null) {
            throw new IllegalArgumentException("projectId cannot be null");
        }
        List<Registration> removed = registrations.remove(projectId);
        if (removed != null) {
            removed.forEach(Registration::deactivate);
            log.debug("Dropped {} subscription(s) of project {}", removed.size(), projectId);
        }
    }

    @Override
    public int subscriberCount() {
        return registrations.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public void close() {
        closed = true;
        registrations.values().forEach(list -> list.forEach(Registration::deactivate));
        registrations.clear();
    }

    private void deliver(Registration registration, StateChangeEvent event) {
        try {
            registration.listener.onChange(event);
        } catch (RuntimeException e) {
            log.warn("Change listener failed for {}/{} version {}: {}",
                event.projectId(), event.section(), event.version(), e.getMessage(), e);
        }
    }

    private void remove(Registration registration) {
        registrations.computeIfPresent(registration.projectId, (key, list) -> {
            list.remove(registration);
            return list.isEmpty() ? null : list;
        });
    }

    /**
     * Subscription handle bound to one registration.
     */
    private final class Registration implements Subscription {
        private final ProjectId projectId;
        private final SectionName section;
        private final ChangeListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(ProjectId projectId, SectionName section, ChangeListener listener) {
            this.projectId = projectId;
            this.section = section;
            this.listener = listener;
        }

        boolean matches(StateChangeEvent event) {
            return active.get() && (section == null || section.equals(event.section()));
        }

        void deactivate() {
            active.set(false);
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
