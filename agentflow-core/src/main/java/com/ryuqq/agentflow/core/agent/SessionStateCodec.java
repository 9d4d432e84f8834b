package com.ryuqq.agentflow.core.agent;

/**
 * Per-agent-kind session state capability.
 *
 * <p>Describes how a session state starts, how new input is folded into it before the
 * runner is invoked, and how it is stored as an opaque blob.</p>
 *
 * @param <S> session state type
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface SessionStateCodec<S> {

    /**
     * State of a session that has never been written.
     */
    S initialState();

    /**
     * Serializes a state into the stored blob.
     */
    String serialize(S state);

    /**
     * Restores a state from the stored blob.
     *
     * @throws IllegalArgumentException if the blob cannot be read
     */
    S deserialize(String blob);

    /**
     * Applies new input to a state (for a transcript, appends a user turn).
     */
    S applyInput(S state, String input);
}
