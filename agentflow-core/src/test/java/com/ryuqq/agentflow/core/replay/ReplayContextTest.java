package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.error.TaskFailedException;
import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.Task;
import com.ryuqq.agentflow.core.outcome.Completed;
import com.ryuqq.agentflow.core.outcome.Failed;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.outcome.ReplayOutcome;
import com.ryuqq.agentflow.core.outcome.ScheduledAction;
import com.ryuqq.agentflow.core.outcome.Suspended;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReplayContext 재실행 규칙 테스트.
 *
 * <p>History를 직접 구성하여 재실행 결과(Completed/Suspended/Failed)와
 * 새로 예약되는 호출 지점을 검증합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class ReplayContextTest {

    private static final JsonCodec JSON = JsonCodec.defaultCodec();
    private static final long CREATED_AT = 1_000L;
    private static final FailureDetails BOOM = new FailureDetails("AdapterException", "boom", true);

    private final InstanceRecord instance =
        InstanceRecord.started(InstanceId.of("inst-1"), "multilingual_writer", JSON.toJson("rain"), null, CREATED_AT);

    /**
     * writer → (french, spanish) fan-out → 결과 병합.
     */
    private final Orchestration writer = ctx -> {
        String text = ctx.getInput(String.class);
        String english = ctx.callAgent("writer", "s1", text).await();
        Task<String> french = ctx.callAgent("french", "s1", english);
        Task<String> spanish = ctx.callAgent("spanish", "s1", english);
        List<String> translations = ctx.allOf(List.of(french, spanish)).await();
        return Map.of("english", english, "french", translations.get(0), "spanish", translations.get(1));
    };

    // ========== 호출 지점 예약 ==========

    @Test
    void replay_EmptyHistory_SchedulesFirstCallSite() {
        // When
        ReplayOutcome outcome = ReplayContext.replay(writer, instance, List.of(), JSON);

        // Then
        Suspended suspended = assertInstanceOf(Suspended.class, outcome);
        assertFalse(suspended.awaitingExternalEvent());
        assertEquals(List.of(new ScheduledAction(0, ActionKind.ENTITY_CALL, "writer", "writer--s1", "rain")),
            suspended.newActions());
    }

    @Test
    void replay_SameHistoryPrefix_ProducesSameActions() {
        // Given
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ENTITY_CALL, "writer", "writer--s1", "rain", CREATED_AT),
            HistoryEvent.completed(1, 0, ActionKind.ENTITY_CALL, "writer", "\"Rain falls\"", 2_000L)
        );

        // When
        ReplayOutcome first = ReplayContext.replay(writer, instance, history, JSON);
        ReplayOutcome second = ReplayContext.replay(writer, instance, history, JSON);

        // Then
        assertEquals(first, second);
    }

    @Test
    void replay_FanOut_SchedulesAllParticipantsTogether() {
        // Given
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ENTITY_CALL, "writer", "writer--s1", "rain", CREATED_AT),
            HistoryEvent.completed(1, 0, ActionKind.ENTITY_CALL, "writer", "\"Rain falls\"", 2_000L)
        );

        // When
        Suspended suspended = assertInstanceOf(Suspended.class, ReplayContext.replay(writer, instance, history, JSON));

        // Then
        assertEquals(2, suspended.newActions().size());
        assertEquals(new ScheduledAction(1, ActionKind.ENTITY_CALL, "french", "french--s1", "Rain falls"),
            suspended.newActions().get(0));
        assertEquals(new ScheduledAction(2, ActionKind.ENTITY_CALL, "spanish", "spanish--s1", "Rain falls"),
            suspended.newActions().get(1));
    }

    @Test
    void replay_AllResolved_CompletesWithJsonOutput() {
        // Given
        List<HistoryEvent> history = fanOutHistory(
            HistoryEvent.completed(4, 1, ActionKind.ENTITY_CALL, "french", "\"Il pleut\"", 3_000L),
            HistoryEvent.completed(5, 2, ActionKind.ENTITY_CALL, "spanish", "\"Llueve\"", 3_100L));

        // When
        Completed completed = assertInstanceOf(Completed.class, ReplayContext.replay(writer, instance, history, JSON));

        // Then
        Map<?, ?> output = JSON.fromJson(completed.output(), Map.class);
        assertEquals("Rain falls", output.get("english"));
        assertEquals("Il pleut", output.get("french"));
        assertEquals("Llueve", output.get("spanish"));
    }

    // ========== allOf 실패 의미 ==========

    @Test
    void replay_AllOfWithOneFailureAndOneOutstanding_FailsWithoutWaiting() {
        // Given
        List<HistoryEvent> history = fanOutHistory(
            HistoryEvent.failed(4, 1, ActionKind.ENTITY_CALL, "french", BOOM, 3_000L));

        // When
        ReplayOutcome outcome = ReplayContext.replay(writer, instance, history, JSON);

        // Then
        Failed failed = assertInstanceOf(Failed.class, outcome);
        assertEquals("AggregateChildFailureException", failed.failure().errorType());
        assertTrue(failed.failure().message().startsWith("1 of the awaited tasks failed"));
        assertTrue(failed.failure().message().contains("french#1"));
        assertFalse(failed.failure().message().contains("spanish"));
    }

    @Test
    void replay_AllOfWithTwoFailures_ListsBoth() {
        // Given
        List<HistoryEvent> history = fanOutHistory(
            HistoryEvent.failed(4, 1, ActionKind.ENTITY_CALL, "french", BOOM, 3_000L),
            HistoryEvent.failed(5, 2, ActionKind.ENTITY_CALL, "spanish", BOOM, 3_100L));

        // When
        Failed failed = assertInstanceOf(Failed.class, ReplayContext.replay(writer, instance, history, JSON));

        // Then
        assertTrue(failed.failure().message().contains("french#1"));
        assertTrue(failed.failure().message().contains("spanish#2"));
    }

    @Test
    void replay_FunctionThrowsError_FailsInsteadOfEscaping() {
        // Given
        Orchestration asserting = ctx -> {
            throw new AssertionError("invariant broken");
        };

        // When
        ReplayOutcome outcome = ReplayContext.replay(asserting, instance, List.of(), JSON);

        // Then
        Failed failed = assertInstanceOf(Failed.class, outcome);
        assertEquals("AssertionError", failed.failure().errorType());
        assertEquals("invariant broken", failed.failure().message());
    }

    @Test
    void replay_AllOfWithFailedParticipant_FailsWithAggregate() {
        // Given
        List<HistoryEvent> history = fanOutHistory(
            HistoryEvent.failed(4, 1, ActionKind.ENTITY_CALL, "french", BOOM, 3_000L),
            HistoryEvent.completed(5, 2, ActionKind.ENTITY_CALL, "spanish", "\"Llueve\"", 3_100L));

        // When
        Failed failed = assertInstanceOf(Failed.class, ReplayContext.replay(writer, instance, history, JSON));

        // Then
        assertEquals("AggregateChildFailureException", failed.failure().errorType());
        assertTrue(failed.failure().message().contains("french#1"));
        assertFalse(failed.failure().message().contains("spanish"));
    }

    @Test
    void replay_AwaitedFailureCaughtByFunction_ContinuesNormally() {
        // Given
        Orchestration tolerant = ctx -> {
            try {
                return ctx.callActivity("book", "x", String.class).await();
            } catch (TaskFailedException e) {
                return "fallback:" + e.getFailure().message();
            }
        };
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ACTIVITY_CALL, "book", null, "\"x\"", CREATED_AT),
            HistoryEvent.failed(1, 0, ActionKind.ACTIVITY_CALL, "book", BOOM, 2_000L));

        // When
        Completed completed = assertInstanceOf(Completed.class, ReplayContext.replay(tolerant, instance, history, JSON));

        // Then
        assertEquals("\"fallback:boom\"", completed.output());
    }

    // ========== anyOf ==========

    @Test
    void replay_AnyOf_LowestCompletionSequenceWins() {
        // Given
        Orchestration race = ctx -> {
            Task<String> slow = ctx.callActivity("slow", null, String.class);
            Task<String> fast = ctx.callActivity("fast", null, String.class);
            Task<?> winner = ctx.anyOf(List.of(slow, fast)).await();
            return winner == fast ? "fast:" + fast.await() : "slow:" + slow.await();
        };
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ACTIVITY_CALL, "slow", null, "null", CREATED_AT),
            HistoryEvent.scheduled(1, 1, ActionKind.ACTIVITY_CALL, "fast", null, "null", CREATED_AT),
            HistoryEvent.completed(2, 1, ActionKind.ACTIVITY_CALL, "fast", "\"f\"", 2_000L),
            HistoryEvent.completed(3, 0, ActionKind.ACTIVITY_CALL, "slow", "\"s\"", 2_000L));

        // When
        Completed completed = assertInstanceOf(Completed.class, ReplayContext.replay(race, instance, history, JSON));

        // Then
        assertEquals("\"fast:f\"", completed.output());
    }

    // ========== 외부 이벤트 ==========

    @Test
    void replay_WaitWithoutEvent_SuspendsAwaitingExternalEvent() {
        // Given
        Orchestration approval = ctx -> {
            ctx.setCustomStatus(Map.of("approval_status", "pending"));
            return ctx.waitForEvent("approval_event", String.class).await();
        };

        // When
        Suspended suspended = assertInstanceOf(Suspended.class,
            ReplayContext.replay(approval, instance, List.of(), JSON));

        // Then
        assertTrue(suspended.awaitingExternalEvent());
        assertEquals("{\"approval_status\":\"pending\"}", suspended.customStatus());
        assertEquals(List.of(new ScheduledAction(0, ActionKind.EXTERNAL_EVENT, "approval_event", null, null)),
            suspended.newActions());
    }

    @Test
    void replay_EventDeliveredBeforeWait_IsBufferedAndConsumed() {
        // Given
        Orchestration approval = ctx -> {
            String english = ctx.callAgent("writer", "s1", "x").await();
            String decision = ctx.waitForEvent("approval_event", String.class).await();
            return english + ":" + decision;
        };
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ENTITY_CALL, "writer", "writer--s1", "x", CREATED_AT),
            HistoryEvent.eventReceived(1, "approval_event", "\"approved\"", "ev-1", 1_500L),
            HistoryEvent.completed(2, 0, ActionKind.ENTITY_CALL, "writer", "\"text\"", 2_000L));

        // When
        Completed completed = assertInstanceOf(Completed.class, ReplayContext.replay(approval, instance, history, JSON));

        // Then
        assertEquals("\"text:approved\"", completed.output());
    }

    @Test
    void replay_RepeatedWaits_ConsumeEventsInArrivalOrder() {
        // Given
        Orchestration twoSignals = ctx -> {
            String first = ctx.waitForEvent("signal", String.class).await();
            String second = ctx.waitForEvent("signal", String.class).await();
            return first + "," + second;
        };
        List<HistoryEvent> history = List.of(
            HistoryEvent.eventReceived(0, "signal", "\"a\"", "ev-1", 1_100L),
            HistoryEvent.eventReceived(1, "other", "\"z\"", "ev-2", 1_200L),
            HistoryEvent.eventReceived(2, "signal", "\"b\"", "ev-3", 1_300L));

        // When
        Completed completed = assertInstanceOf(Completed.class, ReplayContext.replay(twoSignals, instance, history, JSON));

        // Then
        assertEquals("\"a,b\"", completed.output());
    }

    // ========== 결정성 ==========

    @Test
    void replay_DifferentCallAtRecordedTaskId_FailsAsNonDeterministic() {
        // Given
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ACTIVITY_CALL, "book", null, "{}", CREATED_AT));

        // When
        Failed failed = assertInstanceOf(Failed.class, ReplayContext.replay(writer, instance, history, JSON));

        // Then
        assertEquals("NonDeterministicOrchestrationException", failed.failure().errorType());
        assertFalse(failed.failure().retryable());
    }

    @Test
    void replay_NonDeterminismSwallowedByFunction_StillFails() {
        // Given
        Orchestration swallowing = ctx -> {
            try {
                ctx.callAgent("writer", "s1", "x");
            } catch (RuntimeException ignored) {
                // 함수가 예외를 삼켜도 인스턴스는 실패해야 함
            }
            return "done";
        };
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.TIMER, "timer", "2000", null, CREATED_AT));

        // When
        Failed failed = assertInstanceOf(Failed.class, ReplayContext.replay(swallowing, instance, history, JSON));

        // Then
        assertEquals("NonDeterministicOrchestrationException", failed.failure().errorType());
    }

    @Test
    void newUuid_IsStableAcrossReplays() {
        // Given
        List<String> seen = new ArrayList<>();
        Orchestration ids = ctx -> {
            seen.add(ctx.newUuid().toString());
            return ctx.callAgent("writer", "", "x").await();
        };

        // When
        Suspended first = assertInstanceOf(Suspended.class, ReplayContext.replay(ids, instance, List.of(), JSON));
        Suspended second = assertInstanceOf(Suspended.class, ReplayContext.replay(ids, instance, List.of(), JSON));

        // Then
        assertEquals(seen.get(0), seen.get(1));
        assertEquals(first.newActions(), second.newActions());
        assertTrue(first.newActions().get(0).target().startsWith("writer--"));
        assertNotEquals("writer--" + seen.get(0), first.newActions().get(0).target());
    }

    // ========== 타이머와 시각 ==========

    @Test
    void createTimer_FireTimeDerivedFromDeterministicClock() {
        // Given
        List<Long> observed = new ArrayList<>();
        Orchestration delayed = ctx -> {
            ctx.createTimer(Duration.ofMinutes(5)).await();
            observed.add(ctx.currentTime().toEpochMilli());
            return "woke";
        };

        // When
        Suspended suspended = assertInstanceOf(Suspended.class, ReplayContext.replay(delayed, instance, List.of(), JSON));
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.TIMER, "timer", "301000", null, CREATED_AT),
            HistoryEvent.completed(1, 0, ActionKind.TIMER, "timer", null, 301_050L));
        ReplayOutcome resumed = ReplayContext.replay(delayed, instance, history, JSON);

        // Then
        assertEquals("301000", suspended.newActions().get(0).target());
        assertInstanceOf(Completed.class, resumed);
        assertEquals(List.of(301_050L), observed);
    }

    // ========== 실패 ==========

    @Test
    void replay_FunctionThrows_FailsWithDetails() {
        // Given
        Orchestration guarded = ctx -> {
            throw new InputMissingException(ctx.getName());
        };

        // When
        Failed failed = assertInstanceOf(Failed.class, ReplayContext.replay(guarded, instance, List.of(), JSON));

        // Then
        assertEquals("InputMissingException", failed.failure().errorType());
        assertTrue(failed.failure().message().contains("multilingual_writer"));
    }

    @Test
    void replay_UnawaitedCallOnCompletion_IsDiscarded() {
        // Given
        Orchestration fireAndForget = ctx -> {
            ctx.callActivity("audit", "x", Void.class);
            return "done";
        };

        // When
        ReplayOutcome outcome = ReplayContext.replay(fireAndForget, instance, List.of(), JSON);

        // Then
        assertInstanceOf(Completed.class, outcome);
    }

    private List<HistoryEvent> fanOutHistory(HistoryEvent... tail) {
        List<HistoryEvent> history = new ArrayList<>(List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ENTITY_CALL, "writer", "writer--s1", "rain", CREATED_AT),
            HistoryEvent.completed(1, 0, ActionKind.ENTITY_CALL, "writer", "\"Rain falls\"", 2_000L),
            HistoryEvent.scheduled(2, 1, ActionKind.ENTITY_CALL, "french", "french--s1", "Rain falls", 2_000L),
            HistoryEvent.scheduled(3, 2, ActionKind.ENTITY_CALL, "spanish", "spanish--s1", "Rain falls", 2_000L)));
        history.addAll(List.of(tail));
        return history;
    }
}
