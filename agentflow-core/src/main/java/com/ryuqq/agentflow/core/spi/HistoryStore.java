package com.ryuqq.agentflow.core.spi;

import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence SPI for orchestration instances and their History.
 *
 * <p>Stores one summary row per instance and an append-only list of History records.</p>
 *
 * <p><strong>Atomicity Guarantee:</strong></p>
 * <ul>
 *   <li>{@link #append} writes the History records and the new summary as one unit</li>
 *   <li>Sequence numbers are contiguous: the first appended record must continue the existing History</li>
 *   <li>A terminal instance (COMPLETED/FAILED) accepts no further appends</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * store.create(InstanceRecord.started(id, "travel_planner", inputJson, null, now));
 *
 * List&lt;HistoryEvent&gt; history = store.getHistory(id);
 * long seq = History.nextSequenceNo(history);
 * store.append(id, List.of(HistoryEvent.scheduled(seq, 0, ENTITY_CALL, agent, key, input, now)),
 *     record.suspended(InstanceStatus.RUNNING, null, now));
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface HistoryStore {

    /**
     * Creates a new instance.
     *
     * @param record the initial summary row
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if an instance with the same id already exists
     */
    void create(InstanceRecord record);

    /**
     * Finds the summary row of an instance.
     *
     * @param instanceId the instance id
     * @return the summary row, or empty if unknown
     * @throws IllegalArgumentException if instanceId is null
     */
    Optional<InstanceRecord> find(InstanceId instanceId);

    /**
     * Returns the full History of an instance, ordered by sequence number.
     *
     * @param instanceId the instance id
     * @return an immutable snapshot of the History (empty for a fresh instance)
     * @throws IllegalArgumentException if instanceId is null
     * @throws IllegalStateException if the instance is unknown
     */
    List<HistoryEvent> getHistory(InstanceId instanceId);

    /**
     * Appends History records and replaces the summary row atomically.
     *
     * @param instanceId the instance id
     * @param events the records to append (may be empty to update only the summary)
     * @param summary the new summary row
     * @throws IllegalArgumentException if any argument is null or the summary belongs to another instance
     * @throws IllegalStateException if the instance is unknown or terminal, or the sequence numbers are not contiguous
     */
    void append(InstanceId instanceId, List<HistoryEvent> events, InstanceRecord summary);

    /**
     * Scans instances in a given status, oldest {@code lastUpdatedAt} first.
     *
     * <p>Used by the recovery scanner to find instances that need re-activation.</p>
     *
     * @param status the status to scan for
     * @param batchSize maximum number of instances to return
     * @return matching instance ids (may be empty)
     * @throws IllegalArgumentException if status is null or batchSize is not positive
     */
    List<InstanceId> scanByStatus(InstanceStatus status, int batchSize);
}
