package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.error.WatchException;
import com.ryuqq.pipeline.core.model.ChangeType;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import com.ryuqq.pipeline.core.spi.Subscription;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: in-process change notification.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>subscribers see CREATE then UPDATE with previous and new values</li>
 *   <li>section filters and unsubscription are honored</li>
 *   <li>state transitions publish progress events</li>
 *   <li>deleting a project publishes DELETE and ends subscriptions</li>
 *   <li>watching an unknown project or a closed coordinator fails</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class ChangeNotificationContractTest extends AbstractContractTest {

    @Test
    void testWatch_CreateThenUpdate() {
        // Given
        ProjectId projectId = initializeProject("001");
        List<StateChangeEvent> events = new CopyOnWriteArrayList<>();
        coordinator.watch(projectId, events::add, SectionName.INFO);

        // When
        coordinator.writeSection(projectId, SectionName.INFO, json("{\"a\":1}"), "init");
        coordinator.updateSection(projectId, SectionName.INFO, json("{\"b\":2}"), UpdateOptions.defaults());
        coordinator.writeSection(projectId, SectionName.DOCUMENTS, json("{\"ignored\":true}"), "other section");

        // Then
        assertEquals(2, events.size());
        assertEquals(ChangeType.CREATE, events.get(0).changeType());
        assertNull(events.get(0).previousValue());
        assertEquals(1, events.get(0).version());
        assertEquals(ChangeType.UPDATE, events.get(1).changeType());
        assertEquals(json("{\"a\":1}"), events.get(1).previousValue());
        assertEquals(json("{\"a\":1,\"b\":2}"), events.get(1).newValue());
    }

    @Test
    void testWatch_TransitionsPublishProgress() {
        ProjectId projectId = initializeProject("002");
        List<StateChangeEvent> events = new CopyOnWriteArrayList<>();
        coordinator.watch(projectId, events::add, null);

        coordinator.transition(projectId, ProjectState.CLARIFYING);

        assertEquals(1, events.size());
        assertEquals(SectionName.PROGRESS, events.get(0).section());
        assertEquals("clarifying", events.get(0).newValue().get("state").asText());
    }

    @Test
    void testUnsubscribe_StopsDelivery() {
        ProjectId projectId = initializeProject("003");
        List<StateChangeEvent> events = new CopyOnWriteArrayList<>();
        Subscription subscription = coordinator.watch(projectId, events::add, null);

        subscription.unsubscribe();
        coordinator.writeSection(projectId, SectionName.INFO, json("{\"a\":1}"), "init");

        assertFalse(subscription.isActive());
        assertTrue(events.isEmpty());
    }

    @Test
    void testDelete_PublishesDeleteAndEndsSubscription() {
        // Given
        ProjectId projectId = initializeProject("004");
        coordinator.writeSection(projectId, SectionName.INFO, json("{\"a\":1}"), "init");
        List<StateChangeEvent> events = new CopyOnWriteArrayList<>();
        Subscription subscription = coordinator.watch(projectId, events::add, null);

        // When
        coordinator.deleteProject(projectId);

        // Then
        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.changeType() == ChangeType.DELETE));
        assertFalse(subscription.isActive());
    }

    @Test
    void testWatch_UnknownProjectOrClosed() {
        assertThrows(WatchException.class,
                () -> coordinator.watch(ProjectId.of("ghost"), event -> { }, null));

        ProjectId projectId = initializeProject("005");
        coordinator.close();

        assertThrows(WatchException.class, () -> coordinator.watch(projectId, event -> { }, null));
    }
}
