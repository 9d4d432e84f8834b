package com.ryuqq.agentflow.application.orchestration;

import com.ryuqq.agentflow.core.contract.EventAck;
import com.ryuqq.agentflow.core.model.InstanceId;

import java.time.Duration;
import java.util.Optional;

/**
 * Client port of the Orchestration Engine.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InstanceId id = client.start("travel_planner", request);
 * // ... the instance suspends PENDING at its approval wait
 * client.raiseEvent(id, "approval_event", "approved");
 * OrchestrationStatus status = client.waitForCompletion(id, Duration.ofSeconds(180));
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface OrchestrationClient {

    /**
     * Starts a new instance with a random instance id.
     *
     * @param name the registered orchestration name
     * @param input the input (serialized to JSON)
     * @return the new instance id
     * @throws com.ryuqq.agentflow.core.error.UnknownOrchestrationException if the name is not registered
     */
    InstanceId start(String name, Object input);

    /**
     * Starts a new instance with a caller-chosen instance id.
     *
     * @throws IllegalStateException if an instance with the same id already exists
     * @throws com.ryuqq.agentflow.core.error.UnknownOrchestrationException if the name is not registered
     */
    InstanceId start(String name, InstanceId instanceId, Object input);

    /**
     * Reads the current status of an instance.
     *
     * @param instanceId the instance id
     * @return the status, or empty if the instance is unknown
     */
    Optional<OrchestrationStatus> status(InstanceId instanceId);

    /**
     * Raises an external event to an instance.
     *
     * <p>The event is published to the Event Bus and delivered asynchronously. Unknown and
     * terminal instances are rejected immediately.</p>
     *
     * @param instanceId the target instance
     * @param eventName the event name
     * @param payload the event payload (serialized to JSON)
     * @return accepted or rejected acknowledgement
     */
    EventAck raiseEvent(InstanceId instanceId, String eventName, Object payload);

    /**
     * Waits until the instance is terminal or the timeout elapses.
     *
     * @param instanceId the instance id
     * @param timeout maximum time to wait
     * @return the terminal status, or the latest non-terminal status when the timeout elapsed
     * @throws IllegalArgumentException if the instance is unknown
     */
    OrchestrationStatus waitForCompletion(InstanceId instanceId, Duration timeout);
}
