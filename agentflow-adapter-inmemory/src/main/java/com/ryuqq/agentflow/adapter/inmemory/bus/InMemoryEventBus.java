package com.ryuqq.agentflow.adapter.inmemory.bus;

import com.ryuqq.agentflow.core.contract.EventMessage;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.spi.EventBus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link EventBus} SPI for testing and reference purposes.
 *
 * <p>Uses a {@link DelayQueue} for delayed delivery, an in-flight map keyed by event id for
 * visibility timeout simulation, and a list as Dead Letter Queue.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Delayed message delivery (publish with delayMs)</li>
 *   <li>Visibility timeout simulation (30 seconds default)</li>
 *   <li>At-least-once delivery semantics</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong> messages are lost on process restart.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedMessage> queue;
    private final ConcurrentHashMap<String, InFlightMessage> inFlight;
    private final List<DeadLetter> deadLetters;
    private final long visibilityTimeoutMs;

    /**
     * Creates a new bus with the default visibility timeout (30 seconds).
     */
    public InMemoryEventBus() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a new bus with a custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryEventBus(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(EventMessage message, long delayMs) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedMessage(message, delayMs));
    }

    @Override
    public List<EventMessage> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        List<EventMessage> result = new ArrayList<>();
        long now = System.currentTimeMillis();

        for (int i = 0; i < batchSize; i++) {
            DelayedMessage delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            inFlight.put(delayed.message.eventId(), new InFlightMessage(delayed.message, now + visibilityTimeoutMs));
            result.add(delayed.message);
        }
        return result;
    }

    @Override
    public void ack(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        inFlight.remove(message.eventId());
    }

    @Override
    public void nack(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (inFlight.remove(message.eventId()) != null) {
            publish(message, 0);
        }
    }

    @Override
    public void publishToDeadLetter(EventMessage message, FailureDetails reason) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        inFlight.remove(message.eventId());
        deadLetters.add(new DeadLetter(message, reason, System.currentTimeMillis()));
    }

    /**
     * Returns in-flight messages whose visibility timeout has expired to the queue.
     *
     * @return number of messages returned to the queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAt <= now && inFlight.remove(entry.getKey(), entry.getValue())) {
                publish(entry.getValue().message, 0);
                count++;
            }
        }
        return count;
    }

    /**
     * Expires the visibility timeout of one in-flight message immediately. Used for testing.
     *
     * @return true if the message was in flight
     */
    public boolean expireVisibilityTimeout(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        InFlightMessage wrapper = inFlight.remove(message.eventId());
        if (wrapper != null) {
            publish(wrapper.message, 0);
            return true;
        }
        return false;
    }

    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int deadLetterSize() {
        return deadLetters.size();
    }

    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(deadLetters);
    }

    public void clear() {
        queue.clear();
        inFlight.clear();
        deadLetters.clear();
    }

    private static final class DelayedMessage implements Delayed {

        private final EventMessage message;
        private final long availableAt;

        DelayedMessage(EventMessage message, long delayMs) {
            this.message = message;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other instanceof DelayedMessage) {
                return Long.compare(availableAt, ((DelayedMessage) other).availableAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static final class InFlightMessage {

        private final EventMessage message;
        private final long visibleAt;

        InFlightMessage(EventMessage message, long visibleAt) {
            this.message = message;
            this.visibleAt = visibleAt;
        }
    }

    /**
     * Dead Letter Queue entry.
     *
     * @param message the undeliverable message
     * @param reason why it was dead-lettered
     * @param timestamp when it was dead-lettered
     */
    public record DeadLetter(EventMessage message, FailureDetails reason, long timestamp) {
    }
}
