package com.ryuqq.agentflow.adapter.inmemory.store;

import com.ryuqq.agentflow.core.history.History;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.spi.HistoryStore;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link HistoryStore} SPI for testing and reference purposes.
 *
 * <p>Each instance is stored as one immutable entry (summary + History snapshot). Appends
 * replace the entry inside {@link ConcurrentHashMap#compute}, so the History and the summary
 * change together or not at all.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Appends copy the History list, O(N) per append</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class InMemoryHistoryStore implements HistoryStore {

    private final ConcurrentHashMap<InstanceId, Entry> instances = new ConcurrentHashMap<>();

    @Override
    public void create(InstanceRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Entry previous = instances.putIfAbsent(record.instanceId(), new Entry(record, List.of()));
        if (previous != null) {
            throw new IllegalStateException("Instance already exists: " + record.instanceId().getValue());
        }
    }

    @Override
    public Optional<InstanceRecord> find(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        Entry entry = instances.get(instanceId);
        return entry == null ? Optional.empty() : Optional.of(entry.record);
    }

    @Override
    public List<HistoryEvent> getHistory(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        Entry entry = instances.get(instanceId);
        if (entry == null) {
            throw new IllegalStateException("Unknown instance: " + instanceId.getValue());
        }
        return entry.history;
    }

    @Override
    public void append(InstanceId instanceId, List<HistoryEvent> events, InstanceRecord summary) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (summary == null) {
            throw new IllegalArgumentException("summary cannot be null");
        }
        if (!instanceId.equals(summary.instanceId())) {
            throw new IllegalArgumentException("summary belongs to " + summary.instanceId().getValue()
                + ", not " + instanceId.getValue());
        }

        instances.compute(instanceId, (id, current) -> {
            if (current == null) {
                throw new IllegalStateException("Unknown instance: " + id.getValue());
            }
            if (current.record.status().isTerminal()) {
                throw new IllegalStateException("Instance " + id.getValue() + " is terminal ("
                    + current.record.status() + ")");
            }
            long expected = History.nextSequenceNo(current.history);
            for (HistoryEvent event : events) {
                if (event.sequenceNo() != expected) {
                    throw new IllegalStateException("Non-contiguous sequenceNo for " + id.getValue()
                        + ": expected " + expected + " but was " + event.sequenceNo());
                }
                expected++;
            }
            List<HistoryEvent> next = new ArrayList<>(current.history.size() + events.size());
            next.addAll(current.history);
            next.addAll(events);
            return new Entry(summary, List.copyOf(next));
        });
    }

    @Override
    public List<InstanceId> scanByStatus(InstanceStatus status, int batchSize) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        return instances.values().stream()
            .map(entry -> entry.record)
            .filter(record -> record.status() == status)
            .sorted(Comparator.comparingLong(InstanceRecord::lastUpdatedAt))
            .limit(batchSize)
            .map(InstanceRecord::instanceId)
            .collect(Collectors.toList());
    }

    public int size() {
        return instances.size();
    }

    public void clear() {
        instances.clear();
    }

    private static final class Entry {

        private final InstanceRecord record;
        private final List<HistoryEvent> history;

        Entry(InstanceRecord record, List<HistoryEvent> history) {
            this.record = record;
            this.history = history;
        }
    }
}
