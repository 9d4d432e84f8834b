package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.application.agent.AgentGateway;
import com.ryuqq.agentflow.application.orchestration.ActivityRegistry;
import com.ryuqq.agentflow.application.orchestration.OrchestrationClient;
import com.ryuqq.agentflow.application.orchestration.OrchestrationRegistry;
import com.ryuqq.agentflow.application.orchestration.OrchestrationStatus;
import com.ryuqq.agentflow.core.contract.EventAck;
import com.ryuqq.agentflow.core.contract.EventMessage;
import com.ryuqq.agentflow.core.error.EventMismatchException;
import com.ryuqq.agentflow.core.error.HistoryLimitExceededException;
import com.ryuqq.agentflow.core.error.TransientInfraException;
import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.History;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.history.ParentLink;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.orchestration.Activity;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.outcome.Completed;
import com.ryuqq.agentflow.core.outcome.Failed;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.outcome.ReplayOutcome;
import com.ryuqq.agentflow.core.outcome.ScheduledAction;
import com.ryuqq.agentflow.core.outcome.Suspended;
import com.ryuqq.agentflow.core.replay.ReplayContext;
import com.ryuqq.agentflow.core.spi.EventBus;
import com.ryuqq.agentflow.core.spi.HistoryStore;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Orchestration Engine 구현체 ({@link OrchestrationClient}).
 *
 * <p>인스턴스 활성화는 항상 인스턴스별 직렬 레인에서 실행됩니다. 활성화 한 번은
 * History를 읽어 Orchestration 함수를 처음부터 재실행하고, 결과에 따라 레코드를 기록한 뒤
 * 새 호출을 디스패치합니다.</p>
 *
 * <p><strong>활성화 흐름:</strong></p>
 * <pre>
 * activate(instanceId)  [인스턴스 레인]
 *   ↓ find + getHistory
 *   ↓ ReplayContext.replay(...)
 *   ├─ Completed → append(summary=COMPLETED) → 부모에게 보고
 *   ├─ Failed    → append(summary=FAILED)    → 부모에게 보고
 *   └─ Suspended → append(SCHEDULED 레코드, summary=RUNNING|PENDING)
 *                  → 기록 후 디스패치 (에이전트 / Activity / 하위 인스턴스 / 타이머)
 *
 * 호출 결과  [인스턴스 레인]
 *   ↓ append(COMPLETED|FAILED 레코드) → activate(instanceId)
 * </pre>
 *
 * <p><strong>호출 지점별 실행 보장:</strong> SCHEDULED 레코드가 저장된 뒤에만 디스패치하므로
 * 정상 동작에서는 호출 지점마다 최대 한 번 실행됩니다. 재시작 후 유실된 호출은
 * {@link InstanceReaper}가 처리합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class DurableOrchestrationRunner implements OrchestrationClient {

    private static final Logger log = LoggerFactory.getLogger(DurableOrchestrationRunner.class);
    private static final long DEFAULT_POLLING_INTERVAL_MS = 10;

    private final HistoryStore historyStore;
    private final EventBus bus;
    private final OrchestrationRegistry orchestrations;
    private final ActivityRegistry activities;
    private final AgentGateway gateway;
    private final JsonCodec json;
    private final EngineConfig config;
    private final KeyedSerialExecutor<InstanceId> lanes;
    private final ExecutorService activityPool;
    private final ScheduledExecutorService timers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * 생성자 (기본 JsonCodec, 기본 설정).
     */
    public DurableOrchestrationRunner(HistoryStore historyStore, EventBus bus, OrchestrationRegistry orchestrations,
                                      ActivityRegistry activities, AgentGateway gateway) {
        this(historyStore, bus, orchestrations, activities, gateway, JsonCodec.defaultCodec(), new EngineConfig());
    }

    /**
     * 생성자.
     *
     * @param historyStore History 저장소
     * @param bus 외부 이벤트 버스
     * @param orchestrations 등록된 Orchestration
     * @param activities 등록된 Activity
     * @param gateway 에이전트 세션 호출 포트
     * @param json JSON codec
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DurableOrchestrationRunner(HistoryStore historyStore, EventBus bus, OrchestrationRegistry orchestrations,
                                      ActivityRegistry activities, AgentGateway gateway, JsonCodec json,
                                      EngineConfig config) {
        if (historyStore == null) {
            throw new IllegalArgumentException("historyStore cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (orchestrations == null) {
            throw new IllegalArgumentException("orchestrations cannot be null");
        }
        if (activities == null) {
            throw new IllegalArgumentException("activities cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.historyStore = historyStore;
        this.bus = bus;
        this.orchestrations = orchestrations;
        this.activities = activities;
        this.gateway = gateway;
        this.json = json;
        this.config = config;
        this.lanes = new KeyedSerialExecutor<>(config.concurrency());
        this.activityPool = Executors.newFixedThreadPool(config.activityConcurrency());
        this.timers = Executors.newSingleThreadScheduledExecutor();
    }

    // ===== OrchestrationClient =====

    @Override
    public InstanceId start(String name, Object input) {
        return start(name, InstanceId.of(UUID.randomUUID().toString()), input);
    }

    @Override
    public InstanceId start(String name, InstanceId instanceId, Object input) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        orchestrations.get(name);

        InstanceRecord record = InstanceRecord.started(instanceId, name, json.toJson(input), null, now());
        historyStore.create(record);
        log.info("Started orchestration {} as {}", name, instanceId.getValue());

        activate(instanceId);
        return instanceId;
    }

    @Override
    public Optional<OrchestrationStatus> status(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        return historyStore.find(instanceId).map(OrchestrationStatus::from);
    }

    @Override
    public EventAck raiseEvent(InstanceId instanceId, String eventName, Object payload) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }

        Optional<InstanceRecord> record = historyStore.find(instanceId);
        if (record.isEmpty()) {
            log.warn("Event {} rejected: unknown instance {}", eventName, instanceId.getValue());
            return EventAck.rejected(instanceId, eventName, "unknown instance");
        }
        if (record.get().status().isTerminal()) {
            log.warn("Event {} rejected: instance {} is {}", eventName, instanceId.getValue(), record.get().status());
            return EventAck.rejected(instanceId, eventName, "instance is " + record.get().status());
        }

        EventMessage message = EventMessage.create(instanceId, eventName, json.toJson(payload));
        bus.publish(message, 0);
        log.debug("Event {} ({}) published for {}", eventName, message.eventId(), instanceId.getValue());
        return EventAck.accepted(message);
    }

    @Override
    public OrchestrationStatus waitForCompletion(InstanceId instanceId, Duration timeout) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        long startNanos = System.nanoTime();
        long timeoutNanos = timeout.toNanos();

        while (true) {
            OrchestrationStatus current = status(instanceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown instance: " + instanceId.getValue()));
            if (current.isTerminal() || System.nanoTime() - startNanos >= timeoutNanos) {
                return current;
            }
            sleep(DEFAULT_POLLING_INTERVAL_MS);
        }
    }

    // ===== Event delivery (EventDeliveryWorker) =====

    /**
     * 외부 이벤트를 인스턴스 레인으로 전달.
     *
     * <p>레인에서 eventId 중복을 제거한 뒤 수신 레코드를 추가하고 인스턴스를 활성화합니다.</p>
     *
     * @param message 이벤트 메시지
     * @return 기록 완료 Future (레인 실행 중 인스턴스가 종료된 경우 EventMismatchException으로 실패)
     * @throws EventMismatchException 인스턴스가 없거나 종료된 경우
     * @throws TransientInfraException 인스턴스의 이벤트 대기열이 가득 찬 경우
     */
    public CompletableFuture<Void> deliverEvent(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        requireOpen(message);
        try {
            return lanes.trySubmit(message.instanceId(), () -> {
                appendEvent(message);
                return null;
            }, config.maxQueuedEventsPerInstance());
        } catch (RejectedExecutionException e) {
            throw new TransientInfraException(
                "Event queue full for instance " + message.instanceId().getValue(), e);
        }
    }

    // ===== Recovery (InstanceReaper) =====

    /**
     * 인스턴스 재활성화 (재실행은 멱등).
     */
    public void resume(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        activate(instanceId);
    }

    /**
     * 이 프로세스에서 실행 중인 호출인지 확인.
     */
    public boolean isInFlight(InstanceId instanceId, int taskId) {
        return inFlight.contains(inFlightKey(instanceId, taskId));
    }

    /**
     * SCHEDULED 레코드의 호출을 다시 디스패치 (타이머 재등록 포함).
     */
    public void redispatch(InstanceId instanceId, HistoryEvent scheduled) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (scheduled == null) {
            throw new IllegalArgumentException("scheduled cannot be null");
        }
        dispatch(instanceId, new ScheduledAction(scheduled.taskId(), scheduled.kind(), scheduled.name(),
            scheduled.target(), scheduled.payload()));
    }

    /**
     * 호출 지점에 FAILED 레코드를 기록.
     */
    public void failAction(InstanceId instanceId, HistoryEvent scheduled, FailureDetails reason) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (scheduled == null) {
            throw new IllegalArgumentException("scheduled cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        resolve(instanceId, scheduled.taskId(), scheduled.kind(), scheduled.name(), null, reason);
    }

    /**
     * 엔진 종료 (진행 중인 활성화 완료 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        timers.shutdownNow();
        activityPool.shutdown();
        if (!activityPool.awaitTermination(30, TimeUnit.SECONDS)) {
            activityPool.shutdownNow();
        }
        lanes.shutdown();
    }

    // ===== Activation =====

    private void activate(InstanceId instanceId) {
        lanes.submit(instanceId, () -> {
            runActivation(instanceId);
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Activation failed for {}", instanceId.getValue(), error);
            }
        });
    }

    private void runActivation(InstanceId instanceId) {
        Optional<InstanceRecord> found = historyStore.find(instanceId);
        if (found.isEmpty() || found.get().status().isTerminal()) {
            return;
        }
        InstanceRecord record = found.get();
        List<HistoryEvent> history = historyStore.getHistory(instanceId);

        Orchestration orchestration;
        try {
            orchestration = orchestrations.get(record.name());
        } catch (RuntimeException e) {
            finish(record, record.failed(FailureDetails.from(e), record.customStatus(), now()));
            return;
        }

        ReplayOutcome outcome = ReplayContext.replay(orchestration, record, history, json);

        if (outcome instanceof Completed) {
            Completed completed = (Completed) outcome;
            finish(record, record.completed(completed.output(), completed.customStatus(), now()));
        } else if (outcome instanceof Failed) {
            Failed failed = (Failed) outcome;
            log.warn("Orchestration {} ({}) failed: {} - {}", record.name(), instanceId.getValue(),
                failed.failure().errorType(), failed.failure().message());
            finish(record, record.failed(failed.failure(), failed.customStatus(), now()));
        } else {
            suspend(record, history, (Suspended) outcome);
        }
    }

    private void suspend(InstanceRecord record, List<HistoryEvent> history, Suspended suspended) {
        InstanceId instanceId = record.instanceId();
        List<ScheduledAction> actions = suspended.newActions();

        if (!actions.isEmpty() && history.size() + actions.size() > config.maxHistoryEvents()) {
            HistoryLimitExceededException limit =
                new HistoryLimitExceededException(instanceId, config.maxHistoryEvents());
            log.warn("Orchestration {} ({}) exceeded history limit {}", record.name(), instanceId.getValue(),
                config.maxHistoryEvents());
            finish(record, record.failed(FailureDetails.from(limit), suspended.customStatus(), now()));
            return;
        }

        InstanceStatus next = suspended.awaitingExternalEvent() ? InstanceStatus.PENDING : InstanceStatus.RUNNING;
        if (actions.isEmpty() && next == record.status()
            && Objects.equals(suspended.customStatus(), record.customStatus())) {
            return;
        }

        long timestamp = now();
        long sequenceNo = History.nextSequenceNo(history);
        List<HistoryEvent> scheduled = new ArrayList<>(actions.size());
        for (ScheduledAction action : actions) {
            scheduled.add(HistoryEvent.scheduled(sequenceNo++, action.taskId(), action.kind(), action.name(),
                action.target(), action.input(), timestamp));
        }

        // 레코드 저장이 먼저, 디스패치는 그 다음
        historyStore.append(instanceId, scheduled, record.suspended(next, suspended.customStatus(), timestamp));
        for (ScheduledAction action : actions) {
            dispatch(instanceId, action);
        }
    }

    private void finish(InstanceRecord record, InstanceRecord terminal) {
        historyStore.append(record.instanceId(), List.of(), terminal);
        log.info("Orchestration {} ({}) finished: {}", record.name(), record.instanceId().getValue(),
            terminal.status());
        reportToParent(terminal);
    }

    private void reportToParent(InstanceRecord terminal) {
        ParentLink parent = terminal.parent();
        if (parent == null) {
            return;
        }
        if (terminal.status() == InstanceStatus.COMPLETED) {
            resolve(parent.parentId(), parent.taskId(), ActionKind.SUB_ORCHESTRATION, terminal.name(),
                terminal.output(), null);
        } else {
            resolve(parent.parentId(), parent.taskId(), ActionKind.SUB_ORCHESTRATION, terminal.name(),
                null, terminal.failure());
        }
    }

    // ===== Dispatch =====

    private void dispatch(InstanceId instanceId, ScheduledAction action) {
        if (action.kind() == ActionKind.EXTERNAL_EVENT) {
            return;
        }
        if (!inFlight.add(inFlightKey(instanceId, action.taskId()))) {
            return;
        }
        switch (action.kind()) {
            case ENTITY_CALL -> dispatchEntityCall(instanceId, action);
            case ACTIVITY_CALL -> dispatchActivity(instanceId, action);
            case SUB_ORCHESTRATION -> dispatchSubOrchestration(instanceId, action);
            case TIMER -> dispatchTimer(instanceId, action);
            default -> throw new IllegalStateException("Unexpected action kind: " + action.kind());
        }
    }

    private void dispatchEntityCall(InstanceId instanceId, ScheduledAction action) {
        SessionKey key = SessionKey.parse(action.target());
        CompletableFuture<String> reply;
        try {
            reply = gateway.submit(key.getAgentName(), key.getSessionId(), action.input());
        } catch (RuntimeException e) {
            fail(instanceId, action, e);
            return;
        }
        reply.whenComplete((output, error) -> {
            if (error != null) {
                fail(instanceId, action, unwrap(error));
            } else {
                complete(instanceId, action, json.toJson(output));
            }
        });
    }

    private void dispatchActivity(InstanceId instanceId, ScheduledAction action) {
        Activity activity;
        try {
            activity = activities.get(action.name());
        } catch (RuntimeException e) {
            fail(instanceId, action, e);
            return;
        }
        activityPool.execute(() -> {
            try {
                Object result = activity.run(action.input());
                complete(instanceId, action, json.toJson(result));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(instanceId, action, e);
            } catch (Exception e) {
                log.warn("Activity {} failed for {}: {}", action.name(), instanceId.getValue(), e.getMessage());
                fail(instanceId, action, e);
            }
        });
    }

    private void dispatchSubOrchestration(InstanceId instanceId, ScheduledAction action) {
        InstanceId childId = InstanceId.of(action.target());
        Optional<InstanceRecord> existing = historyStore.find(childId);
        if (existing.isPresent()) {
            if (existing.get().status().isTerminal()) {
                reportToParent(existing.get());
            } else {
                activate(childId);
            }
            return;
        }

        try {
            orchestrations.get(action.name());
        } catch (RuntimeException e) {
            fail(instanceId, action, e);
            return;
        }
        ParentLink parent = new ParentLink(instanceId, action.taskId());
        historyStore.create(InstanceRecord.started(childId, action.name(), action.input(), parent, now()));
        log.info("Started sub-orchestration {} as {}", action.name(), childId.getValue());
        activate(childId);
    }

    private void dispatchTimer(InstanceId instanceId, ScheduledAction action) {
        long fireAt = Long.parseLong(action.target());
        long delay = Math.max(0, fireAt - now());
        timers.schedule(() -> complete(instanceId, action, null), delay, TimeUnit.MILLISECONDS);
    }

    // ===== Resolution =====

    private void complete(InstanceId instanceId, ScheduledAction action, String payload) {
        resolve(instanceId, action.taskId(), action.kind(), action.name(), payload, null);
    }

    private void fail(InstanceId instanceId, ScheduledAction action, Throwable error) {
        resolve(instanceId, action.taskId(), action.kind(), action.name(), null, FailureDetails.from(error));
    }

    private void resolve(InstanceId instanceId, int taskId, ActionKind kind, String name,
                         String payload, FailureDetails failure) {
        lanes.submit(instanceId, () -> {
            inFlight.remove(inFlightKey(instanceId, taskId));
            appendResolution(instanceId, taskId, kind, name, payload, failure);
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Failed to record result of {}#{} for {}", name, taskId, instanceId.getValue(), error);
            }
        });
    }

    private void appendResolution(InstanceId instanceId, int taskId, ActionKind kind, String name,
                                  String payload, FailureDetails failure) {
        Optional<InstanceRecord> found = historyStore.find(instanceId);
        if (found.isEmpty() || found.get().status().isTerminal()) {
            log.debug("Dropping result of {}#{}: instance {} is gone or terminal", name, taskId,
                instanceId.getValue());
            return;
        }
        List<HistoryEvent> history = historyStore.getHistory(instanceId);
        if (History.isResolved(history, taskId)) {
            log.debug("Ignoring duplicate result of {}#{} for {}", name, taskId, instanceId.getValue());
            return;
        }

        long timestamp = now();
        long sequenceNo = History.nextSequenceNo(history);
        HistoryEvent event = failure == null
            ? HistoryEvent.completed(sequenceNo, taskId, kind, name, payload, timestamp)
            : HistoryEvent.failed(sequenceNo, taskId, kind, name, failure, timestamp);
        historyStore.append(instanceId, List.of(event), found.get().touched(timestamp));
        runActivation(instanceId);
    }

    private void appendEvent(EventMessage message) {
        InstanceId instanceId = message.instanceId();
        InstanceRecord record = requireOpen(message);
        List<HistoryEvent> history = historyStore.getHistory(instanceId);
        if (History.containsEvent(history, message.eventId())) {
            log.debug("Ignoring duplicate event {} ({}) for {}", message.eventName(), message.eventId(),
                instanceId.getValue());
            return;
        }

        long timestamp = now();
        HistoryEvent event = HistoryEvent.eventReceived(History.nextSequenceNo(history), message.eventName(),
            message.payload(), message.eventId(), timestamp);
        historyStore.append(instanceId, List.of(event), record.touched(timestamp));
        log.info("Event {} recorded for {}", message.eventName(), instanceId.getValue());
        runActivation(instanceId);
    }

    private InstanceRecord requireOpen(EventMessage message) {
        InstanceRecord record = historyStore.find(message.instanceId())
            .orElseThrow(() -> new EventMismatchException(message.instanceId(), message.eventName(),
                "unknown instance"));
        if (record.status().isTerminal()) {
            throw new EventMismatchException(message.instanceId(), message.eventName(),
                "instance is " + record.status());
        }
        return record;
    }

    private static String inFlightKey(InstanceId instanceId, int taskId) {
        return instanceId.getValue() + "#" + taskId;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Polling interrupted", e);
        }
    }
}
