package com.ryuqq.agentflow.core.agent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TranscriptCodec 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class TranscriptCodecTest {

    private final TranscriptCodec codec = new TranscriptCodec();

    @Test
    void applyInput_AppendsUserTurn() {
        // Given
        Transcript state = codec.initialState();

        // When
        Transcript next = codec.applyInput(state, "Write a haiku about rain");

        // Then
        assertEquals(0, state.size());
        assertEquals(1, next.size());
        assertEquals(Turn.user("Write a haiku about rain"), next.last());
    }

    @Test
    void serialize_RestoresSameTurnsInOrder() {
        // Given
        Transcript transcript = Transcript.empty()
            .append(Turn.user("hello"))
            .append(Turn.assistant("hi there"));

        // When
        String blob = codec.serialize(transcript);
        Transcript restored = codec.deserialize(blob);

        // Then
        assertTrue(blob.contains("\"role\":\"assistant\""));
        assertEquals(transcript, restored);
    }

    @Test
    void deserialize_InvalidBlob_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> codec.deserialize("not json"));
    }
}
