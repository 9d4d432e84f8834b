package com.ryuqq.agentflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.agentflow.core.statemachine.InstanceStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_RunningToPending_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(RUNNING, PENDING));
    }

    @Test
    void validate_PendingToRunning_Succeeds() {
        assertDoesNotThrow(() -> StatusTransition.validate(PENDING, RUNNING));
    }

    @Test
    void transition_ApprovalFlow_EndsCompleted() {
        // Given
        InstanceStatus status = RUNNING;

        // When
        status = StatusTransition.transition(status, PENDING);
        status = StatusTransition.transition(status, RUNNING);
        status = StatusTransition.transition(status, COMPLETED);

        // Then
        assertEquals(COMPLETED, status);
        assertTrue(status.isTerminal());
    }

    // ========== 종료 상태 전이 금지 ==========

    @Test
    void validate_CompletedToRunning_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StatusTransition.validate(COMPLETED, RUNNING)
        );
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void validate_FailedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(FAILED, COMPLETED));
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(null, RUNNING));
    }

    @Test
    void isTerminal_OnlyCompletedAndFailed() {
        assertFalse(RUNNING.isTerminal());
        assertFalse(PENDING.isTerminal());
        assertTrue(COMPLETED.isTerminal());
        assertTrue(FAILED.isTerminal());
    }
}
