package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.coordinator.StateCoordinator;
import com.ryuqq.pipeline.core.error.InvalidTransitionException;
import com.ryuqq.pipeline.core.error.StateValidationException;
import com.ryuqq.pipeline.core.model.HistoryEntry;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import com.ryuqq.pipeline.core.statemachine.SkipOptions;
import com.ryuqq.pipeline.core.statemachine.SkipResult;
import com.ryuqq.pipeline.core.statemachine.TransitionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: pipeline state transitions through the file-backed coordinator.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>collecting → clarifying succeeds, clarifying → merged is rejected and state is unchanged</li>
 *   <li>cancelled is terminal: every further transition is rejected</li>
 *   <li>skip and recovery edges record skipped stages and reasons</li>
 *   <li>state survives a new coordinator over the same directory</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class StateTransitionContractTest extends AbstractContractTest {

    @Test
    void testTransition_ValidThenInvalidThenCancelled() {
        // Given: project 001 in collecting
        ProjectId projectId = initializeProject("001");
        assertState(projectId, ProjectState.COLLECTING);

        // When: collecting -> clarifying
        TransitionResult result = coordinator.transition(projectId, ProjectState.CLARIFYING);

        // Then
        assertEquals(ProjectState.COLLECTING, result.previousState());
        assertState(projectId, ProjectState.CLARIFYING);

        // When/Then: clarifying -> merged is not an edge
        InvalidTransitionException invalid = assertThrows(InvalidTransitionException.class,
                () -> coordinator.transition(projectId, ProjectState.MERGED));
        assertEquals("STATE-004", invalid.getErrorCode().code());
        assertState(projectId, ProjectState.CLARIFYING);

        // When: clarifying -> cancelled
        coordinator.transition(projectId, ProjectState.CANCELLED);
        assertState(projectId, ProjectState.CANCELLED);

        // Then: nothing leaves cancelled
        for (ProjectState target : ProjectState.values()) {
            assertThrows(InvalidTransitionException.class, () -> coordinator.transition(projectId, target),
                    "cancelled must not transition to " + target);
        }
        assertState(projectId, ProjectState.CANCELLED);
    }

    @Test
    void testTransition_HistoryDescribesEachChange() {
        // Given
        ProjectId projectId = initializeProject("002");
        coordinator.transition(projectId, ProjectState.CLARIFYING);
        coordinator.transition(projectId, ProjectState.PRD_DRAFTING);

        // When
        List<HistoryEntry> recent = coordinator.recentActivity(projectId, 10);

        // Then: newest first
        assertEquals(3, recent.size());
        assertEquals("transitioned from clarifying to prd_drafting", recent.get(0).description());
        assertEquals("transitioned from collecting to clarifying", recent.get(1).description());
        assertEquals("Initial state", recent.get(2).description());
    }

    @Test
    void testSkipAndRecover() {
        // Given
        ProjectId projectId = initializeProject("003");

        // When: skip collecting -> prd_drafting
        SkipResult skip = coordinator.skipTo(projectId, ProjectState.PRD_DRAFTING, SkipOptions.defaults());

        // Then
        assertEquals(List.of(ProjectState.CLARIFYING), skip.skippedStages());
        assertState(projectId, ProjectState.PRD_DRAFTING);

        // When: recover prd_drafting -> clarifying
        coordinator.recoverTo(projectId, ProjectState.CLARIFYING, "requirements changed");

        // Then
        assertState(projectId, ProjectState.CLARIFYING);
        assertEquals("recovered from prd_drafting to clarifying (requirements changed)",
                coordinator.recentActivity(projectId, 1).get(0).description());

        // When/Then: clarifying has no skip edges
        InvalidTransitionException invalidSkip = assertThrows(InvalidTransitionException.class,
                () -> coordinator.skipTo(projectId, ProjectState.SRS_DRAFTING, SkipOptions.forced("rush")));
        assertEquals("STATE-008", invalidSkip.getErrorCode().code());
    }

    @Test
    void testInitialize_TerminalStateRejected() {
        ProjectId projectId = ProjectId.of("004");

        assertThrows(StateValidationException.class,
                () -> coordinator.initializeProject(projectId, "done", ProjectState.MERGED));
        assertFalse(coordinator.listProjects().contains(projectId));
    }

    @Test
    void testState_VisibleToAnotherCoordinator() {
        // Given
        ProjectId projectId = initializeProject("005");
        coordinator.transition(projectId, ProjectState.CLARIFYING);

        // When
        StateCoordinator other = newCoordinator(config);

        // Then
        assertEquals(ProjectState.CLARIFYING, other.currentState(projectId));
        other.transition(projectId, ProjectState.PRD_DRAFTING);
        assertState(projectId, ProjectState.PRD_DRAFTING);
    }
}
