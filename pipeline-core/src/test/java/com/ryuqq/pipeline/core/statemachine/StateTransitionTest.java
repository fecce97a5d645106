package com.ryuqq.pipeline.core.statemachine;

import com.ryuqq.pipeline.core.error.ErrorCategory;
import com.ryuqq.pipeline.core.error.ErrorCode;
import com.ryuqq.pipeline.core.error.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import static com.ryuqq.pipeline.core.statemachine.ProjectState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>collecting → clarifying 성공, collecting → merged 실패</li>
 *   <li>종료 상태에서는 모든 전이 실패 (cancelled 재진입 포함)</li>
 *   <li>진행률은 정규 단계 위치로 계산</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_CollectingToClarifying_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(COLLECTING, CLARIFYING));
    }

    @Test
    void transition_FullForwardFlow_ReachesMerged() {
        // Given
        ProjectState state = COLLECTING;

        // When
        state = StateTransition.transition(state, PRD_DRAFTING);
        state = StateTransition.transition(state, PRD_APPROVED);
        state = StateTransition.transition(state, SRS_DRAFTING);
        state = StateTransition.transition(state, SRS_APPROVED);
        state = StateTransition.transition(state, SDS_DRAFTING);
        state = StateTransition.transition(state, SDS_APPROVED);
        state = StateTransition.transition(state, ISSUES_CREATING);
        state = StateTransition.transition(state, ISSUES_CREATED);
        state = StateTransition.transition(state, IMPLEMENTING);
        state = StateTransition.transition(state, PR_REVIEW);
        state = StateTransition.transition(state, MERGED);

        // Then
        assertEquals(MERGED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_CollectingToMerged_ThrowsInvalidTransition() {
        // When & Then
        InvalidTransitionException exception = assertThrows(
            InvalidTransitionException.class,
            () -> StateTransition.validate(COLLECTING, MERGED)
        );
        assertEquals(ErrorCode.INVALID_TRANSITION, exception.getErrorCode());
        assertEquals(ErrorCategory.FATAL, exception.getCategory());
        assertEquals(COLLECTING, exception.getFrom());
        assertEquals(MERGED, exception.getTo());
        assertTrue(exception.getMessage().contains("collecting -> merged"));
    }

    @Test
    void validate_FromCancelled_AlwaysThrows() {
        for (ProjectState target : ProjectState.values()) {
            InvalidTransitionException exception = assertThrows(
                InvalidTransitionException.class,
                () -> StateTransition.validate(CANCELLED, target)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
        }
    }

    @Test
    void validate_FromMerged_AlwaysThrows() {
        for (ProjectState target : ProjectState.values()) {
            assertThrows(InvalidTransitionException.class, () -> StateTransition.validate(MERGED, target));
        }
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, COLLECTING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(COLLECTING, null));
    }

    // ========== 진행률 ==========

    @Test
    void progressPercent_CanonicalPositions() {
        assertEquals(0, StateTransition.progressPercent(COLLECTING));
        assertEquals(8, StateTransition.progressPercent(CLARIFYING));
        assertEquals(50, StateTransition.progressPercent(SDS_DRAFTING));
        assertEquals(92, StateTransition.progressPercent(PR_REVIEW));
        assertEquals(100, StateTransition.progressPercent(MERGED));
    }

    @Test
    void progressPercent_Cancelled_ReturnsZero() {
        assertEquals(0, StateTransition.progressPercent(CANCELLED));
    }
}
