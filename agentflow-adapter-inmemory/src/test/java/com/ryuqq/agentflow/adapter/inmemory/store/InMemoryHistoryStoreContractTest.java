package com.ryuqq.agentflow.adapter.inmemory.store;

import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.spi.HistoryStore;
import com.ryuqq.agentflow.testkit.contract.HistoryStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for InMemoryHistoryStore adapter.
 *
 * @author Agentflow Team
 * @since 1.0.0
 * @see HistoryStoreContractTest
 */
class InMemoryHistoryStoreContractTest extends HistoryStoreContractTest {

    @Override
    protected HistoryStore createStore() {
        return new InMemoryHistoryStore();
    }

    @Test
    void append_ConcurrentWritersWithSameSequence_OnlyOneWins() throws InterruptedException {
        // Given
        InstanceId id = InstanceId.of("i-1");
        InstanceRecord record = started("i-1", 100L);
        store.create(record);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        List<Throwable> failures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            int eventIndex = i;
            executor.submit(() -> {
                try {
                    start.await();
                    store.append(id, List.of(HistoryEvent.eventReceived(0, "approval_event", "{}",
                        "e-" + eventIndex, 200L)), record.touched(200L));
                    successes.incrementAndGet();
                } catch (IllegalStateException e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(1, successes.get());
        assertEquals(threads - 1, failures.size());
        assertEquals(1, store.getHistory(id).size());
    }

    @Test
    void append_SummaryForOtherInstance_ThrowsException() {
        // Given
        store.create(started("i-1", 100L));
        store.create(started("i-2", 100L));

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> store.append(InstanceId.of("i-1"),
            List.of(HistoryEvent.scheduled(0, 0, ActionKind.TIMER, "timer", "1", null, 1L)),
            started("i-2", 100L)));
    }
}
