package com.ryuqq.agentflow.core.history;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionKindTest {

    @Test
    void isCall_DispatchedKinds_ReturnsTrue() {
        assertTrue(ActionKind.ENTITY_CALL.isCall());
        assertTrue(ActionKind.ACTIVITY_CALL.isCall());
        assertTrue(ActionKind.SUB_ORCHESTRATION.isCall());
    }

    @Test
    void isCall_TimerAndExternalEvent_ReturnsFalse() {
        assertFalse(ActionKind.TIMER.isCall());
        assertFalse(ActionKind.EXTERNAL_EVENT.isCall());
    }
}
