package com.ryuqq.agentflow.adapter.inmemory.store;

import com.ryuqq.agentflow.core.error.TransientInfraException;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.spi.ConversationStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link ConversationStore} SPI.
 *
 * <p>Backed by a {@link ConcurrentHashMap}; every put replaces the blob atomically.
 * {@link #failNext(int)} injects transient failures for tests.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class InMemoryConversationStore implements ConversationStore {

    private final ConcurrentHashMap<SessionKey, String> states = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();

    @Override
    public Optional<String> get(SessionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        maybeFail("get", key);
        return Optional.ofNullable(states.get(key));
    }

    @Override
    public void put(SessionKey key, String state) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        maybeFail("put", key);
        states.put(key, state);
    }

    /**
     * Makes the next {@code count} store calls fail with {@link TransientInfraException}.
     *
     * @param count number of calls to fail
     */
    public void failNext(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative, but was: " + count);
        }
        pendingFailures.set(count);
    }

    public int size() {
        return states.size();
    }

    public void clear() {
        states.clear();
        pendingFailures.set(0);
    }

    private void maybeFail(String operation, SessionKey key) {
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransientInfraException("Injected failure on " + operation + " for " + key.asString());
        }
    }
}
