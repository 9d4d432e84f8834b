package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.NonDeterministicOrchestrationException;
import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.ActionStatus;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.OrchestrationContext;
import com.ryuqq.agentflow.core.orchestration.Task;
import com.ryuqq.agentflow.core.outcome.Completed;
import com.ryuqq.agentflow.core.outcome.Failed;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.outcome.ReplayOutcome;
import com.ryuqq.agentflow.core.outcome.ScheduledAction;
import com.ryuqq.agentflow.core.outcome.Suspended;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * 결정적 재실행(replay) 스케줄러.
 *
 * <p>Orchestration 함수를 처음부터 실행하면서 각 호출 지점의 결과를 History에서 채우고,
 * 기록이 없는 호출 지점을 새 {@link ScheduledAction}으로 모읍니다.
 * 함수는 결과가 없는 Task를 await하는 순간 중단됩니다.</p>
 *
 * <p><strong>재실행 규칙:</strong></p>
 * <ol>
 *   <li>호출 지점은 실행 순서대로 taskId 0, 1, 2, ... 를 받습니다</li>
 *   <li>같은 taskId의 레코드가 있으면 종류와 이름이 일치해야 합니다 (불일치 시 인스턴스 실패)</li>
 *   <li>레코드가 없는 호출 지점은 한 번의 실행에서 모두 모아 함께 예약됩니다</li>
 *   <li>이름이 E인 n번째 이벤트 대기는 n번째로 수신된 E 이벤트를 받습니다</li>
 * </ol>
 *
 * <p>이 클래스는 스레드 안전하지 않으며, 한 번의 실행에만 사용됩니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class ReplayContext implements OrchestrationContext {

    static final String TIMER_NAME = "timer";

    private final InstanceRecord instance;
    private final JsonCodec json;
    private final Map<Integer, HistoryEvent> scheduledByTask = new HashMap<>();
    private final Map<Integer, HistoryEvent> resolutionByTask = new HashMap<>();
    private final Map<String, List<HistoryEvent>> receivedByName = new HashMap<>();
    private final Map<String, Integer> waitOrdinals = new HashMap<>();
    private final List<ScheduledAction> newActions = new ArrayList<>();
    private final int lastRecordedTaskId;

    private int nextTaskId;
    private int uuidCounter;
    private long clock;
    private String customStatus;
    private NonDeterministicOrchestrationException violation;

    private ReplayContext(InstanceRecord instance, List<HistoryEvent> history, JsonCodec json) {
        this.instance = instance;
        this.json = json;
        this.clock = instance.createdAt();

        int lastTaskId = -1;
        for (HistoryEvent event : history) {
            if (event.isReceivedEvent()) {
                receivedByName.computeIfAbsent(event.name(), k -> new ArrayList<>()).add(event);
                continue;
            }
            if (event.status() == ActionStatus.SCHEDULED) {
                scheduledByTask.putIfAbsent(event.taskId(), event);
            } else {
                resolutionByTask.putIfAbsent(event.taskId(), event);
            }
            lastTaskId = Math.max(lastTaskId, event.taskId());
        }
        this.lastRecordedTaskId = lastTaskId;
    }

    /**
     * History에 대해 Orchestration 함수를 한 번 재실행.
     *
     * @param orchestration Orchestration 함수
     * @param instance 인스턴스 요약 레코드 (입력, 생성 시각)
     * @param history 지금까지의 History (순번 순)
     * @param json JSON codec
     * @return 재실행 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static ReplayOutcome replay(Orchestration orchestration, InstanceRecord instance,
                                       List<HistoryEvent> history, JsonCodec json) {
        if (orchestration == null) {
            throw new IllegalArgumentException("orchestration cannot be null");
        }
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        return new ReplayContext(instance, history, json).execute(orchestration);
    }

    private ReplayOutcome execute(Orchestration orchestration) {
        Object output;
        try {
            output = orchestration.run(this);
        } catch (OrchestrationSuspendedSignal signal) {
            if (violation != null) {
                return new Failed(FailureDetails.from(violation), customStatus);
            }
            return new Suspended(newActions, signal.isAwaitingExternalEvent(), customStatus);
        } catch (Exception | Error e) {
            return new Failed(FailureDetails.from(violation != null ? violation : e), customStatus);
        }

        if (violation != null) {
            return new Failed(FailureDetails.from(violation), customStatus);
        }
        try {
            return new Completed(json.toJson(output), customStatus);
        } catch (IllegalArgumentException e) {
            return new Failed(FailureDetails.from(e), customStatus);
        }
    }

    @Override
    public InstanceId getInstanceId() {
        return instance.instanceId();
    }

    @Override
    public String getName() {
        return instance.name();
    }

    @Override
    public <T> T getInput(Class<T> type) {
        return json.fromJson(instance.input(), type);
    }

    @Override
    public Instant currentTime() {
        return Instant.ofEpochMilli(clock);
    }

    @Override
    public UUID newUuid() {
        String seed = instance.instanceId().getValue() + ":" + uuidCounter++;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean isReplaying() {
        return nextTaskId <= lastRecordedTaskId;
    }

    @Override
    public void setCustomStatus(Object customStatus) {
        this.customStatus = customStatus == null ? null : json.toJson(customStatus);
    }

    @Override
    public Task<String> callAgent(String agentName, String sessionId, Object input) {
        String effectiveSessionId = sessionId == null || sessionId.isBlank() ? newUuid().toString() : sessionId;
        SessionKey key = SessionKey.of(agentName, effectiveSessionId);
        String text = input instanceof String ? (String) input : json.toJson(input);
        return newCallSite(ActionKind.ENTITY_CALL, agentName, key.asString(), text, decoder(String.class));
    }

    @Override
    public <T> Task<T> callActivity(String name, Object input, Class<T> resultType) {
        return newCallSite(ActionKind.ACTIVITY_CALL, name, null, json.toJson(input), decoder(resultType));
    }

    @Override
    public <T> Task<T> callSubOrchestration(String name, Object input, Class<T> resultType) {
        String childId = instance.instanceId().child(nextTaskId).getValue();
        return newCallSite(ActionKind.SUB_ORCHESTRATION, name, childId, json.toJson(input), decoder(resultType));
    }

    @Override
    public Task<Void> createTimer(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative");
        }
        long fireAt = clock + delay.toMillis();
        return newCallSite(ActionKind.TIMER, TIMER_NAME, String.valueOf(fireAt), null, payload -> null);
    }

    @Override
    public <T> Task<T> waitForEvent(String eventName, Class<T> payloadType) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        int taskId = nextTaskId++;
        HistoryEvent recorded = scheduledByTask.get(taskId);
        checkDeterminism(taskId, recorded, ActionKind.EXTERNAL_EVENT, eventName);

        int ordinal = waitOrdinals.merge(eventName, 1, Integer::sum) - 1;
        List<HistoryEvent> received = receivedByName.getOrDefault(eventName, List.of());
        HistoryEvent resolution = ordinal < received.size() ? received.get(ordinal) : null;

        if (resolution == null && recorded == null) {
            newActions.add(new ScheduledAction(taskId, ActionKind.EXTERNAL_EVENT, eventName, null, null));
        }
        return new CallTask<>(this, taskId, ActionKind.EXTERNAL_EVENT, eventName, resolution, decoder(payloadType));
    }

    @Override
    public <T> Task<List<T>> allOf(List<Task<T>> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        List<ReplayTask<T>> participants = new ArrayList<>(tasks.size());
        for (Task<T> task : tasks) {
            participants.add(own(task));
        }
        return new AllOfTask<>(this, participants);
    }

    @Override
    public Task<Task<?>> anyOf(List<? extends Task<?>> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("tasks cannot be null or empty");
        }
        List<ReplayTask<?>> participants = new ArrayList<>(tasks.size());
        for (Task<?> task : tasks) {
            participants.add(own(task));
        }
        return new AnyOfTask(this, participants);
    }

    OrchestrationSuspendedSignal suspend(ReplayTask<?> task) {
        return new OrchestrationSuspendedSignal(task.waitsForExternalEvent());
    }

    void advanceClock(long timestamp) {
        if (timestamp > clock) {
            clock = timestamp;
        }
    }

    private <V> CallTask<V> newCallSite(ActionKind kind, String name, String target, String input,
                                        Function<String, V> decoder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        int taskId = nextTaskId++;
        HistoryEvent recorded = scheduledByTask.get(taskId);
        HistoryEvent resolution = resolutionByTask.get(taskId);
        checkDeterminism(taskId, recorded != null ? recorded : resolution, kind, name);

        if (recorded == null && resolution == null) {
            newActions.add(new ScheduledAction(taskId, kind, name, target, input));
        }
        return new CallTask<>(this, taskId, kind, name, resolution, decoder);
    }

    private void checkDeterminism(int taskId, HistoryEvent recorded, ActionKind kind, String name) {
        if (recorded == null) {
            return;
        }
        if (recorded.kind() != kind || !recorded.name().equals(name)) {
            violation = new NonDeterministicOrchestrationException(
                taskId, recorded.kind() + " " + recorded.name(), kind + " " + name);
            throw violation;
        }
    }

    private <V> Function<String, V> decoder(Class<V> type) {
        return payload -> json.fromJson(payload, type);
    }

    @SuppressWarnings("unchecked")
    private <V> ReplayTask<V> own(Task<V> task) {
        if (!(task instanceof ReplayTask)) {
            throw new IllegalArgumentException("task was not created by this context: " + task);
        }
        ReplayTask<V> replayTask = (ReplayTask<V>) task;
        if (replayTask.context() != this) {
            throw new IllegalArgumentException("task was created by another replay");
        }
        return replayTask;
    }
}
