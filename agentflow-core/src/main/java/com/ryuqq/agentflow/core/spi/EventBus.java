package com.ryuqq.agentflow.core.spi;

import com.ryuqq.agentflow.core.contract.EventMessage;
import com.ryuqq.agentflow.core.outcome.FailureDetails;

import java.util.List;

/**
 * Message Queue SPI for external event delivery.
 *
 * <p>External signals (for example a human approval) are published here by the client
 * and consumed by the event delivery worker, which routes them to the owning instance.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: ack/nack operations should be idempotent</li>
 *   <li>Visibility Timeout: dequeued messages reappear if neither acked nor nacked in time</li>
 *   <li>At-least-once Delivery: Messages may be delivered multiple times</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.publish(EventMessage.create(instanceId, "approval_event", "\"approved\""), 0L);
 *
 * for (EventMessage message : bus.dequeue(10)) {
 *     try {
 *         deliver(message);
 *         bus.ack(message);
 *     } catch (Exception e) {
 *         bus.nack(message);
 *     }
 * }
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes a message with optional delay.
     *
     * @param message the message to publish
     * @param delayMs delay in milliseconds before the message becomes available (0 for immediate)
     * @throws IllegalArgumentException if message is null or delayMs is negative
     */
    void publish(EventMessage message, long delayMs);

    /**
     * Dequeues a batch of messages, hiding them from other consumers for the visibility timeout.
     *
     * @param batchSize maximum number of messages to retrieve
     * @return dequeued messages (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<EventMessage> dequeue(int batchSize);

    /**
     * Acknowledges a processed message, removing it permanently.
     *
     * @param message the message to acknowledge
     * @throws IllegalArgumentException if message is null
     */
    void ack(EventMessage message);

    /**
     * Returns a message to the queue for immediate redelivery.
     *
     * @param message the message to negative acknowledge
     * @throws IllegalArgumentException if message is null
     */
    void nack(EventMessage message);

    /**
     * Moves a message that cannot be delivered to the Dead Letter Queue.
     *
     * @param message the undeliverable message
     * @param reason why the message was dead-lettered
     * @throws IllegalArgumentException if message or reason is null
     */
    void publishToDeadLetter(EventMessage message, FailureDetails reason);
}
