package com.ryuqq.pipeline.adapter.inmemory.notifier;

import com.fasterxml.jackson.databind.node.IntNode;
import com.ryuqq.pipeline.core.error.WatchException;
import com.ryuqq.pipeline.core.model.ChangeType;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.spi.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChangeNotifierTest {

    private static final ProjectId PROJECT = ProjectId.of("001");
    private static final ProjectId OTHER = ProjectId.of("002");

    private InMemoryChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new InMemoryChangeNotifier();
    }

    private static StateChangeEvent event(ProjectId projectId, SectionName section, long version) {
        return new StateChangeEvent(projectId, section, null, IntNode.valueOf((int) version), version,
            version == 1 ? ChangeType.CREATE : ChangeType.UPDATE, 1_000L);
    }

    @Test
    void publish_DeliversToMatchingSectionAndProjectWideSubscribers() {
        // given
        List<String> received = new ArrayList<>();
        notifier.subscribe(PROJECT, SectionName.INFO, e -> received.add("info:" + e.version()));
        notifier.subscribe(PROJECT, null, e -> received.add("all:" + e.section().getValue()));
        notifier.subscribe(PROJECT, SectionName.ISSUES, e -> received.add("issues:" + e.version()));
        notifier.subscribe(OTHER, null, e -> received.add("other"));

        // when
        notifier.publish(event(PROJECT, SectionName.INFO, 1));

        // then
        assertEquals(List.of("info:1", "all:info"), received);
    }

    @Test
    void publish_PreservesSubscriptionOrder() {
        // given
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int index = i;
            notifier.subscribe(PROJECT, i % 2 == 0 ? null : SectionName.INFO, e -> order.add(index));
        }

        // when
        notifier.publish(event(PROJECT, SectionName.INFO, 1));

        // then
        assertEquals(List.of(0, 1, 2, 3, 4), order);
    }

    @Test
    void publish_FailingListener_OthersStillReceive() {
        // given
        List<Long> received = new ArrayList<>();
        notifier.subscribe(PROJECT, null, e -> {
            throw new IllegalStateException("listener bug");
        });
        notifier.subscribe(PROJECT, null, e -> received.add(e.version()));

        // when
        assertDoesNotThrow(() -> notifier.publish(event(PROJECT, SectionName.INFO, 2)));

        // then
        assertEquals(List.of(2L), received);
    }

    @Test
    void unsubscribe_StopsDeliveryAndIsIdempotent() {
        // given
        List<Long> received = new ArrayList<>();
        Subscription subscription = notifier.subscribe(PROJECT, SectionName.INFO, e -> received.add(e.version()));
        notifier.publish(event(PROJECT, SectionName.INFO, 1));

        // when
        subscription.unsubscribe();
        subscription.unsubscribe();
        notifier.publish(event(PROJECT, SectionName.INFO, 2));

        // then
        assertEquals(List.of(1L), received);
        assertFalse(subscription.isActive());
        assertEquals(0, notifier.subscriberCount());
    }

    @Test
    void unsubscribeProject_DropsOnlyThatProject() {
        // given
        Subscription first = notifier.subscribe(PROJECT, SectionName.INFO, e -> { });
        Subscription second = notifier.subscribe(PROJECT, null, e -> { });
        Subscription other = notifier.subscribe(OTHER, null, e -> { });

        // when
        notifier.unsubscribeProject(PROJECT);

        // then
        assertFalse(first.isActive());
        assertFalse(second.isActive());
        assertTrue(other.isActive());
        assertEquals(1, notifier.subscriberCount());
    }

    @Test
    void close_RejectsNewSubscriptionsAndDropsEvents() {
        // given
        List<Long> received = new ArrayList<>();
        Subscription subscription = notifier.subscribe(PROJECT, null, e -> received.add(e.version()));

        // when
        notifier.close();
        notifier.publish(event(PROJECT, SectionName.INFO, 1));

        // then
        assertTrue(received.isEmpty());
        assertFalse(subscription.isActive());
        assertThrows(WatchException.class, () -> notifier.subscribe(PROJECT, null, e -> { }));
    }

    @Test
    void subscribe_NullListener_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> notifier.subscribe(PROJECT, null, null));
    }
}
