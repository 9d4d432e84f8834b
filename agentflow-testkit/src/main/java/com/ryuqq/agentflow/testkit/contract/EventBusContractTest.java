package com.ryuqq.agentflow.testkit.contract;

import com.ryuqq.agentflow.core.contract.EventMessage;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.spi.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link EventBus} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>publish → dequeue delivers the message</li>
 *   <li>delayed messages stay invisible until due</li>
 *   <li>ack removes, nack redelivers</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public abstract class EventBusContractTest {

    protected EventBus bus;

    protected abstract EventBus createBus();

    @BeforeEach
    void setUpBus() {
        bus = createBus();
    }

    @Test
    void publish_ThenDequeue_DeliversMessage() {
        // Given
        EventMessage message = EventMessage.create(InstanceId.of("i-1"), "approval_event", "{\"approved\":true}");

        // When
        bus.publish(message, 0);
        List<EventMessage> batch = bus.dequeue(10);

        // Then
        assertEquals(List.of(message), batch);
    }

    @Test
    void publish_WithDelay_NotVisibleUntilDue() {
        // Given
        EventMessage message = EventMessage.create(InstanceId.of("i-1"), "approval_event", "{}");

        // When
        bus.publish(message, 200);

        // Then
        assertTrue(bus.dequeue(10).isEmpty());
        sleep(300);
        assertEquals(1, bus.dequeue(10).size());
    }

    @Test
    void ack_RemovesMessage() {
        // Given
        EventMessage message = EventMessage.create(InstanceId.of("i-1"), "approval_event", "{}");
        bus.publish(message, 0);
        bus.dequeue(1);

        // When
        bus.ack(message);

        // Then
        assertTrue(bus.dequeue(10).isEmpty());
    }

    @Test
    void nack_RedeliversMessage() {
        // Given
        EventMessage message = EventMessage.create(InstanceId.of("i-1"), "approval_event", "{}");
        bus.publish(message, 0);
        bus.dequeue(1);

        // When
        bus.nack(message);

        // Then
        assertEquals(List.of(message), bus.dequeue(10));
    }

    @Test
    void dequeue_RespectsBatchSize() {
        // Given
        for (int i = 0; i < 5; i++) {
            bus.publish(EventMessage.create(InstanceId.of("i-" + i), "approval_event", "{}"), 0);
        }

        // When & Then
        assertEquals(3, bus.dequeue(3).size());
        assertEquals(2, bus.dequeue(3).size());
    }

    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
