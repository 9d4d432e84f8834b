package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 오류 분류 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class DurableAgentExceptionTest {

    @Test
    void sessionBusy_IsTransientAndRetryable() {
        // When
        SessionBusyException exception = new SessionBusyException(SessionKey.of("haiku_agent", "s1"), 64, null);

        // Then
        assertInstanceOf(TransientInfraException.class, exception);
        assertEquals("SESSION-BUSY", exception.getErrorCode());
        assertTrue(exception.isRetryable());
        assertTrue(exception.getMessage().contains("haiku_agent--s1"));
    }

    @Test
    void unknownAgent_IsNotRetryable() {
        // When
        UnknownAgentException exception = new UnknownAgentException("german_translator_agent");

        // Then
        assertEquals("AGENT-UNKNOWN", exception.getErrorCode());
        assertFalse(exception.isRetryable());
    }

    @Test
    void taskFailed_CarriesTaskAndRetryableFlagOfFailure() {
        // Given
        FailureDetails failure = new FailureDetails("AdapterException", "model down", true);

        // When
        TaskFailedException exception = new TaskFailedException("writer", 2, failure);

        // Then
        assertEquals("writer", exception.getTaskName());
        assertEquals(2, exception.getTaskId());
        assertSame(failure, exception.getFailure());
        assertTrue(exception.isRetryable());
        assertEquals("Task writer#2 failed: AdapterException: model down", exception.getMessage());
    }

    @Test
    void aggregateChildFailure_ListsEveryFailedParticipant() {
        // Given
        List<ChildFailure> failures = List.of(
            new ChildFailure(1, "french_translator_agent", new FailureDetails("AdapterException", "timeout", true)),
            new ChildFailure(2, "spanish_translator_agent", new FailureDetails("AdapterException", "quota", true)));

        // When
        AggregateChildFailureException exception = new AggregateChildFailureException(failures);

        // Then
        assertEquals(2, exception.getFailures().size());
        assertTrue(exception.isRetryable());
        assertTrue(exception.getMessage().startsWith("2 of the awaited tasks failed"));
        assertTrue(exception.getMessage().contains("spanish_translator_agent#2"));
    }

    @Test
    void aggregateChildFailure_OneTerminalChild_IsNotRetryable() {
        // Given
        List<ChildFailure> failures = List.of(
            new ChildFailure(1, "french_translator_agent", new FailureDetails("AdapterException", "timeout", true)),
            new ChildFailure(2, "book_travel_activity",
                new FailureDetails("IllegalArgumentException", "input missing", false)));

        // When
        AggregateChildFailureException exception = new AggregateChildFailureException(failures);

        // Then
        assertFalse(exception.isRetryable());
    }

    @Test
    void aggregateChildFailure_EmptyList_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new AggregateChildFailureException(List.of()));
    }

    @Test
    void eventMismatch_KeepsTargetAndEventName() {
        // When
        EventMismatchException exception =
            new EventMismatchException(InstanceId.of("trip-1"), "approval_event", "instance is COMPLETED");

        // Then
        assertEquals(InstanceId.of("trip-1"), exception.getInstanceId());
        assertEquals("approval_event", exception.getEventName());
        assertEquals("EVENT-MISMATCH", exception.getErrorCode());
        assertFalse(exception.isRetryable());
    }
}
