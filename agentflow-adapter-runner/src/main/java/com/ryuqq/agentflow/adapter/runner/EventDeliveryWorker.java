package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.application.runtime.Runtime;
import com.ryuqq.agentflow.core.contract.EventMessage;
import com.ryuqq.agentflow.core.error.DurableAgentException;
import com.ryuqq.agentflow.core.error.EventMismatchException;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.spi.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Event Bus 소비자 ({@link Runtime} 구현체).
 *
 * <p>Event Bus에서 외부 이벤트를 가져와 Orchestration Engine의 인스턴스 레인으로 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * dequeue(batchSize) → [Event1, Event2, ...]
 *   ↓
 * For each Event:
 *   engine.deliverEvent(event)
 *     - 기록 완료 → bus.ack
 *     - EventMismatchException (없는/종료된 인스턴스) → WARN 로그 + DLQ
 *     - 재시도 가능 실패 → ack + backoff 후 재게시 (attempt + 1), maxRetries 초과 시 DLQ
 *     - 그 외 실패 → DLQ
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class EventDeliveryWorker implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(EventDeliveryWorker.class);

    private final EventBus bus;
    private final DurableOrchestrationRunner engine;
    private final EventWorkerConfig config;
    private final BackoffCalculator backoffCalculator;
    private ScheduledExecutorService scheduler;

    public EventDeliveryWorker(EventBus bus, DurableOrchestrationRunner engine, EventWorkerConfig config) {
        this(bus, engine, config, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param bus Event Bus
     * @param engine Orchestration Engine
     * @param config 설정
     * @param backoffCalculator 재전달 간격 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventDeliveryWorker(EventBus bus, DurableOrchestrationRunner engine, EventWorkerConfig config,
                               BackoffCalculator backoffCalculator) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.bus = bus;
        this.engine = engine;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    @Override
    public void pump() {
        List<EventMessage> messages = bus.dequeue(config.batchSize());
        for (EventMessage message : messages) {
            deliver(message);
        }
    }

    /**
     * pollingIntervalMs 주기로 pump() 실행 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("EventDeliveryWorker already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::safePump, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("EventDeliveryWorker started (polling every {}ms)", config.pollingIntervalMs());
    }

    /**
     * 주기 실행 종료.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        log.info("EventDeliveryWorker stopped");
    }

    private void safePump() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Event pump failed", e);
        }
    }

    private void deliver(EventMessage message) {
        CompletableFuture<Void> delivery;
        try {
            delivery = engine.deliverEvent(message);
        } catch (RuntimeException e) {
            handleFailure(message, e);
            return;
        }
        delivery.whenComplete((ignored, error) -> {
            if (error == null) {
                bus.ack(message);
            } else {
                handleFailure(message, unwrap(error));
            }
        });
    }

    private void handleFailure(EventMessage message, Throwable error) {
        if (error instanceof EventMismatchException) {
            log.warn("Event {} ({}) not deliverable to {}: {}", message.eventName(), message.eventId(),
                message.instanceId().getValue(), error.getMessage());
            bus.publishToDeadLetter(message, FailureDetails.from(error));
            return;
        }

        boolean retryable = error instanceof DurableAgentException && ((DurableAgentException) error).isRetryable();
        if (retryable && message.attempt() < config.maxRetries()) {
            long delay = backoffCalculator.calculate(message.attempt());
            bus.ack(message);
            bus.publish(message.nextAttempt(), delay);
            log.info("Event {} for {} re-published after {}ms (attempt {})", message.eventName(),
                message.instanceId().getValue(), delay, message.attempt() + 1);
            return;
        }

        log.error("Event {} for {} dead-lettered after {} attempts", message.eventName(),
            message.instanceId().getValue(), message.attempt(), error);
        bus.publishToDeadLetter(message, FailureDetails.from(error));
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
