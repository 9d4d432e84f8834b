package com.ryuqq.agentflow.application.runtime;

/**
 * Message-driven runtime.
 *
 * <p>Implemented by components that poll an SPI queue and route what they dequeue,
 * such as the external event delivery worker.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   ↓
 * 1. Dequeue a batch of messages from the bus
 * 2. For each message:
 *    a. Route it to the owning instance lane
 *    b. Success → ack
 *    c. Transient failure → re-publish with backoff, dead-letter after maxRetries
 *    d. Soft failure (unknown or terminal instance) → log and dead-letter
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is typically invoked repeatedly from a background scheduler</li>
 *   <li>Implementations must be thread-safe</li>
 *   <li>pump() never throws for a single bad message; it logs and continues</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Processes one batch of queued messages.
     */
    void pump();
}
