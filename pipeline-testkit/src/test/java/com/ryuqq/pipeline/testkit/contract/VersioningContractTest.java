package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.coordinator.StateCoordinator;
import com.ryuqq.pipeline.core.error.HistoryException;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.SectionSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: per-section versions and bounded history.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>each committed write increments the section version by exactly one</li>
 *   <li>history keeps the newest entries up to the configured maximum</li>
 *   <li>restoring an entry is itself a new version</li>
 *   <li>sections are versioned independently</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class VersioningContractTest extends AbstractContractTest {

    private static final SectionName DOCUMENTS = SectionName.DOCUMENTS;

    @Test
    void testVersion_IncrementsPerWrite() {
        // Given
        ProjectId projectId = initializeProject("001");
        assertEquals(0, coordinator.version(projectId, DOCUMENTS));

        // When
        for (int i = 1; i <= 4; i++) {
            SectionSnapshot snapshot = coordinator.writeSection(projectId, DOCUMENTS,
                    json("{\"revision\":" + i + "}"), "revision " + i);

            // Then
            assertEquals(i, snapshot.version());
        }
        assertEquals(4, coordinator.version(projectId, DOCUMENTS));
        assertEquals(1, coordinator.version(projectId, SectionName.PROGRESS));
    }

    @Test
    void testHistory_BoundedToNewestEntries() {
        // Given: history limited to 3 entries
        StateCoordinator bounded = newCoordinator(config.withMaxHistoryEntries(3));
        ProjectId projectId = ProjectId.of("002");
        bounded.initializeProject(projectId, "bounded");

        // When
        for (int i = 1; i <= 5; i++) {
            bounded.writeSection(projectId, DOCUMENTS, json("{\"revision\":" + i + "}"), "revision " + i);
        }

        // Then
        List<HistoryEntry> history = bounded.getHistory(projectId, DOCUMENTS);
        assertEquals(List.of(3L, 4L, 5L), history.stream().map(HistoryEntry::sequence).collect(Collectors.toList()));
        assertEquals("revision 5", history.get(2).description());
    }

    @Test
    void testRestore_CreatesNewVersion() {
        // Given
        ProjectId projectId = initializeProject("003");
        coordinator.writeSection(projectId, DOCUMENTS, json("{\"prd\":\"v1\"}"), "first draft");
        coordinator.writeSection(projectId, DOCUMENTS, json("{\"prd\":\"v2\"}"), "second draft");

        // When
        SectionSnapshot restored = coordinator.restoreFromHistory(projectId, DOCUMENTS, 1);

        // Then
        assertEquals(3, restored.version());
        assertSectionValue(projectId, DOCUMENTS, "{\"prd\":\"v1\"}");
        SectionSnapshot withHistory = coordinator.readSection(projectId, DOCUMENTS,
                ReadOptions.defaults().withIncludeHistory(true)).orElseThrow();
        assertEquals(3, withHistory.history().size());

        // When/Then: unknown sequence
        assertThrows(HistoryException.class, () -> coordinator.restoreFromHistory(projectId, DOCUMENTS, 99));
        assertEquals(3, coordinator.version(projectId, DOCUMENTS));
    }
}
