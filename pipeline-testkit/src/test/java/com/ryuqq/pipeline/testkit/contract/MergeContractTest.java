package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.error.SectionNotFoundException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.ReadOptions;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.model.UpdateOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: section update semantics.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>merge replaces top-level keys of the patch and keeps the rest</li>
 *   <li>replace discards the previous value</li>
 *   <li>merging into a missing section creates it</li>
 *   <li>the progress section cannot be written directly</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class MergeContractTest extends AbstractContractTest {

    private static final SectionName INFO = SectionName.INFO;

    @Test
    void testMerge_TopLevelKeys() {
        // Given
        ProjectId projectId = initializeProject("001");
        coordinator.writeSection(projectId, INFO, json("{\"title\":\"order\",\"owner\":{\"team\":\"a\"}}"), "init");

        // When
        coordinator.updateSection(projectId, INFO, json("{\"owner\":{\"lead\":\"kim\"},\"priority\":1}"),
                UpdateOptions.defaults());

        // Then: nested objects are replaced as a whole
        assertSectionValue(projectId, INFO, "{\"title\":\"order\",\"owner\":{\"lead\":\"kim\"},\"priority\":1}");
        assertEquals(2, coordinator.version(projectId, INFO));
    }

    @Test
    void testReplace_DiscardsPreviousValue() {
        ProjectId projectId = initializeProject("002");
        coordinator.writeSection(projectId, INFO, json("{\"title\":\"order\",\"priority\":1}"), "init");

        coordinator.updateSection(projectId, INFO, json("{\"title\":\"payment\"}"),
                UpdateOptions.replace().withDescription("renamed"));

        assertSectionValue(projectId, INFO, "{\"title\":\"payment\"}");
        assertEquals("renamed", coordinator.getHistory(projectId, INFO).get(1).description());
    }

    @Test
    void testMerge_IntoMissingSectionCreatesIt() {
        ProjectId projectId = initializeProject("003");
        assertThrows(SectionNotFoundException.class,
                () -> coordinator.readSection(projectId, SectionName.ISSUES, ReadOptions.defaults()));

        coordinator.updateSection(projectId, SectionName.ISSUES, json("{\"count\":3}"), UpdateOptions.defaults());

        assertSectionValue(projectId, SectionName.ISSUES, "{\"count\":3}");
        assertEquals(1, coordinator.version(projectId, SectionName.ISSUES));
    }

    @Test
    void testProgressSection_IsReserved() {
        ProjectId projectId = initializeProject("004");

        assertThrows(StateValidationException.class,
                () -> coordinator.updateSection(projectId, SectionName.PROGRESS,
                        json("{\"state\":\"merged\"}"), UpdateOptions.defaults()));
        assertEquals(1, coordinator.version(projectId, SectionName.PROGRESS));
    }
}
