package com.ryuqq.pipeline.adapter.inmemory.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.ryuqq.pipeline.adapter.inmemory.notifier.InMemoryChangeNotifier;
import com.ryuqq.pipeline.core.error.HistoryException;
import com.ryuqq.pipeline.core.error.ProjectAlreadyExistsException;
import com.ryuqq.pipeline.core.error.ProjectNotFoundException;
import com.ryuqq.pipeline.core.error.SectionNotFoundException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.json.Jsons;
import com.ryuqq.pipeline.core.model.ChangeType;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import com.ryuqq.pipeline.core.model.StateChangeEvent;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    private static final ProjectId PROJECT = ProjectId.of("001");

    private InMemoryChangeNotifier notifier;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        notifier = new InMemoryChangeNotifier();
        store = new InMemoryStateStore(3, notifier);
        store.createProject(PROJECT, "demo");
    }

    private static ObjectNode object(String field, int value) {
        ObjectNode node = Jsons.objectNode();
        node.put(field, value);
        return node;
    }

    @Test
    void createProject_Duplicate_ThrowsAlreadyExists() {
        assertThrows(ProjectAlreadyExistsException.class, () -> store.createProject(PROJECT, "again"));
        assertEquals("demo", store.getProject(PROJECT).name());
    }

    @Test
    void createProject_BlankName_UsesProjectId() {
        store.createProject(ProjectId.of("002"), " ");

        assertEquals("002", store.getProject(ProjectId.of("002")).name());
        assertEquals(List.of(PROJECT, ProjectId.of("002")), store.listProjects());
    }

    @Test
    void updateSection_MergesIntoExistingObject() {
        // given
        store.writeSection(PROJECT, SectionName.INFO, object("a", 1), null);

        // when
        SectionSnapshot result = store.updateSection(PROJECT, SectionName.INFO, object("b", 2), UpdateOptions.defaults());

        // then
        assertEquals(Jsons.parse("{\"a\":1,\"b\":2}"), result.value());
        assertEquals(2L, result.version());
        assertEquals(2, store.getHistory(PROJECT, SectionName.INFO).size());
    }

    @Test
    void updateSection_MergeWithArrayPatch_ThrowsValidation() {
        assertThrows(StateValidationException.class, () ->
            store.updateSection(PROJECT, SectionName.INFO, Jsons.parse("[1,2]"), UpdateOptions.defaults()));
        assertEquals(0L, store.version(PROJECT, SectionName.INFO));
    }

    @Test
    void updateSection_ReplaceWithScalar_Allowed() {
        store.writeSection(PROJECT, SectionName.INFO, object("a", 1), null);

        SectionSnapshot result = store.updateSection(PROJECT, SectionName.INFO, TextNode.valueOf("done"),
            UpdateOptions.replace());

        assertEquals(TextNode.valueOf("done"), result.value());
    }

    @Test
    void readSection_ReturnsCopy_MutationDoesNotLeak() {
        // given
        store.writeSection(PROJECT, SectionName.INFO, object("a", 1), null);

        // when
        SectionSnapshot read = store.readSection(PROJECT, SectionName.INFO, ReadOptions.defaults()).orElseThrow();
        ((ObjectNode) read.value()).put("a", 99);

        // then
        SectionSnapshot again = store.readSection(PROJECT, SectionName.INFO, ReadOptions.defaults()).orElseThrow();
        assertEquals(1, again.value().get("a").asInt());
    }

    @Test
    void readSection_MissingSectionOrProject() {
        assertThrows(SectionNotFoundException.class,
            () -> store.readSection(PROJECT, SectionName.ISSUES, ReadOptions.defaults()));
        assertTrue(store.readSection(PROJECT, SectionName.ISSUES, ReadOptions.defaults().withAllowMissing(true)).isEmpty());
        assertThrows(ProjectNotFoundException.class,
            () -> store.readSection(ProjectId.of("999"), SectionName.ISSUES, ReadOptions.defaults()));
    }

    @Test
    void history_KeepsNewestEntriesOnly() {
        for (int i = 1; i <= 5; i++) {
            store.writeSection(PROJECT, SectionName.INFO, object("n", i), "write " + i);
        }

        List<Long> sequences = store.getHistory(PROJECT, SectionName.INFO).stream()
            .map(HistoryEntry::sequence)
            .collect(Collectors.toList());
        assertEquals(List.of(3L, 4L, 5L), sequences);
        assertEquals(5L, store.version(PROJECT, SectionName.INFO));
    }

    @Test
    void restoreFromHistory_EvictedSequence_ThrowsHistoryError() {
        for (int i = 1; i <= 5; i++) {
            store.writeSection(PROJECT, SectionName.INFO, object("n", i), null);
        }

        assertThrows(HistoryException.class, () -> store.restoreFromHistory(PROJECT, SectionName.INFO, 1));
        SectionSnapshot restored = store.restoreFromHistory(PROJECT, SectionName.INFO, 4);
        assertEquals(object("n", 4), restored.value());
        assertEquals(6L, restored.version());
    }

    @Test
    void concurrentCompute_NoLostUpdates() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 100; i++) {
            futures.add(executor.submit(() -> store.computeSection(PROJECT, SectionName.PROGRESS,
                current -> object("count", current.map(s -> s.value().get("count").asInt()).orElse(0) + 1),
                "increment")));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        assertEquals(100L, store.version(PROJECT, SectionName.PROGRESS));
        SectionSnapshot result = store.readSection(PROJECT, SectionName.PROGRESS, ReadOptions.defaults()).orElseThrow();
        assertEquals(100, result.value().get("count").asInt());
    }

    @Test
    void deleteProject_PublishesDeleteEventsAndDropsSubscriptions() {
        // given
        List<StateChangeEvent> events = new ArrayList<>();
        store.writeSection(PROJECT, SectionName.ISSUES, object("n", 1), null);
        store.writeSection(PROJECT, SectionName.INFO, object("a", 1), null);
        notifier.subscribe(PROJECT, null, events::add);

        // when
        List<SectionName> deleted = store.deleteProject(PROJECT);

        // then
        assertEquals(List.of(SectionName.INFO, SectionName.ISSUES), deleted);
        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.changeType() == ChangeType.DELETE && e.newValue() == null));
        assertEquals(0, notifier.subscriberCount());
        assertFalse(store.projectExists(PROJECT));
    }
}
