package com.ryuqq.agentflow.core.outcome;

import com.ryuqq.agentflow.core.error.AdapterException;
import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.model.SessionKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FailureDetails 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class FailureDetailsTest {

    @Test
    void from_RetryableDomainException_KeepsRetryableFlag() {
        // Given
        AdapterException exception = new AdapterException(
            SessionKey.of("writer", "s1"), new IllegalStateException("model overloaded"));

        // When
        FailureDetails details = FailureDetails.from(exception);

        // Then
        assertEquals("AdapterException", details.errorType());
        assertTrue(details.message().contains("model overloaded"));
        assertTrue(details.retryable());
    }

    @Test
    void from_NonRetryableDomainException_IsNotRetryable() {
        // When
        FailureDetails details = FailureDetails.from(new InputMissingException("multilingual_writer"));

        // Then
        assertEquals("InputMissingException", details.errorType());
        assertFalse(details.retryable());
    }

    @Test
    void from_PlainException_WithoutMessage_UsesEmptyMessage() {
        // When
        FailureDetails details = FailureDetails.from(new NullPointerException());

        // Then
        assertEquals("NullPointerException", details.errorType());
        assertEquals("", details.message());
        assertFalse(details.retryable());
    }
}
