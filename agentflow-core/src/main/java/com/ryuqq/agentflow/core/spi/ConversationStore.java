package com.ryuqq.agentflow.core.spi;

import com.ryuqq.agentflow.core.model.SessionKey;

import java.util.Optional;

/**
 * Durable key-value SPI for conversation state.
 *
 * <p>Each {@link SessionKey} maps to one opaque, serialized session state blob.
 * The Session Entity is the only writer of a key, and it serializes its own calls,
 * so implementations only need per-key atomicity.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Read-your-write: a {@code get} after a successful {@code put} on the same key sees it</li>
 *   <li>Ordering: puts on the same key are applied in issue order</li>
 *   <li>Atomicity: a {@code put} either fully replaces the blob or has no effect</li>
 *   <li>Thread-safe: methods may be called from multiple threads for different keys</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface ConversationStore {

    /**
     * Loads the serialized state of a session.
     *
     * @param key the session key
     * @return the serialized state, or empty if the session has never been written
     * @throws IllegalArgumentException if key is null
     * @throws com.ryuqq.agentflow.core.error.TransientInfraException if the store is temporarily unavailable
     */
    Optional<String> get(SessionKey key);

    /**
     * Replaces the serialized state of a session.
     *
     * @param key the session key
     * @param state the serialized state
     * @throws IllegalArgumentException if key or state is null
     * @throws com.ryuqq.agentflow.core.error.TransientInfraException if the store is temporarily unavailable
     */
    void put(SessionKey key, String state);
}
