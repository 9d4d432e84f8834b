package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.spi.HistoryStore;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InstanceReaper 유닛 테스트.
 *
 * <ul>
 *   <li>FAIL 전략: 유실된 호출에 FAILED 레코드 기록</li>
 *   <li>RETRY 전략: 유실된 호출 재디스패치</li>
 *   <li>타이머 / 하위 인스턴스 재등록</li>
 *   <li>임계값 이내 또는 실행 중인 호출은 건드리지 않음</li>
 *   <li>예외 발생 시에도 다음 인스턴스 계속 처리</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InstanceReaperTest {

    private static final InstanceId INSTANCE = InstanceId.of("writer-1");

    @Mock
    private HistoryStore historyStore;

    @Mock
    private DurableOrchestrationRunner engine;

    private ReaperConfig config;
    private InstanceReaper reaper;

    @BeforeEach
    void setUp() {
        config = new ReaperConfig().withStuckThresholdMs(1000);
        reaper = new InstanceReaper(historyStore, engine, config);
    }

    @Test
    void scan_FAIL_전략이면_유실된_호출에_FAILED를_기록함() {
        // given
        HistoryEvent stuck = entityCall(0, 0L);
        givenOpenInstances(List.of(INSTANCE), List.of());
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(stuck));
        when(engine.isInFlight(INSTANCE, 0)).thenReturn(false);

        // when
        int reconciled = reaper.scan();

        // then
        ArgumentCaptor<FailureDetails> reason = ArgumentCaptor.forClass(FailureDetails.class);
        verify(engine).failAction(eq(INSTANCE), eq(stuck), reason.capture());
        assertThat(reason.getValue().errorType()).isEqualTo("TransientInfraException");
        assertThat(reason.getValue().message()).contains("lost in flight");
        verify(engine).resume(INSTANCE);
        assertThat(reconciled).isEqualTo(1);
    }

    @Test
    void scan_RETRY_전략이면_유실된_호출을_재디스패치함() {
        // given
        reaper = new InstanceReaper(historyStore, engine, config.withDefaultStrategy(ReconcileStrategy.RETRY));
        HistoryEvent stuck = entityCall(0, 0L);
        givenOpenInstances(List.of(INSTANCE), List.of());
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(stuck));
        when(engine.isInFlight(INSTANCE, 0)).thenReturn(false);

        // when
        reaper.scan();

        // then
        verify(engine).redispatch(INSTANCE, stuck);
        verify(engine, never()).failAction(any(), any(), any());
    }

    @Test
    void scan_임계값_이내의_호출은_건드리지_않음() {
        // given
        HistoryEvent fresh = entityCall(0, System.currentTimeMillis());
        givenOpenInstances(List.of(), List.of(INSTANCE));
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(fresh));
        when(engine.isInFlight(INSTANCE, 0)).thenReturn(false);

        // when
        reaper.scan();

        // then
        verify(engine, never()).failAction(any(), any(), any());
        verify(engine, never()).redispatch(any(), any());
        verify(engine).resume(INSTANCE);
    }

    @Test
    void scan_실행_중인_호출은_건너뜀() {
        // given
        HistoryEvent running = entityCall(0, 0L);
        givenOpenInstances(List.of(INSTANCE), List.of());
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(running));
        when(engine.isInFlight(INSTANCE, 0)).thenReturn(true);

        // when
        reaper.scan();

        // then
        verify(engine, never()).failAction(any(), any(), any());
        verify(engine, never()).redispatch(any(), any());
    }

    @Test
    void scan_타이머는_경과_시간과_무관하게_재등록함() {
        // given
        long now = System.currentTimeMillis();
        HistoryEvent timer = HistoryEvent.scheduled(0, 0, ActionKind.TIMER, "timer",
            String.valueOf(now + 60_000), null, now);
        givenOpenInstances(List.of(INSTANCE), List.of());
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(timer));
        when(engine.isInFlight(INSTANCE, 0)).thenReturn(false);

        // when
        reaper.scan();

        // then
        verify(engine).redispatch(INSTANCE, timer);
    }

    @Test
    void scan_해소된_호출은_대상이_아님() {
        // given
        HistoryEvent scheduled = entityCall(0, 0L);
        HistoryEvent completed = HistoryEvent.completed(1, 0, ActionKind.ENTITY_CALL, "haiku_agent", "\"poem\"", 10L);
        givenOpenInstances(List.of(INSTANCE), List.of());
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of(scheduled, completed));

        // when
        reaper.scan();

        // then
        verify(engine, never()).isInFlight(any(), anyInt());
        verify(engine).resume(INSTANCE);
    }

    @Test
    void scan_한_인스턴스_실패가_다른_인스턴스_처리를_막지_않음() {
        // given
        InstanceId broken = InstanceId.of("broken");
        givenOpenInstances(List.of(broken, INSTANCE), List.of());
        when(historyStore.getHistory(broken)).thenThrow(new IllegalStateException("Unknown instance: broken"));
        when(historyStore.getHistory(INSTANCE)).thenReturn(List.of());

        // when
        int reconciled = reaper.scan();

        // then
        assertThat(reconciled).isEqualTo(1);
        verify(engine).resume(INSTANCE);
        verify(engine, never()).resume(broken);
    }

    private void givenOpenInstances(List<InstanceId> running, List<InstanceId> pending) {
        when(historyStore.scanByStatus(InstanceStatus.RUNNING, 50)).thenReturn(running);
        when(historyStore.scanByStatus(InstanceStatus.PENDING, 50)).thenReturn(pending);
    }

    private static HistoryEvent entityCall(int taskId, long timestamp) {
        return HistoryEvent.scheduled(taskId, taskId, ActionKind.ENTITY_CALL, "haiku_agent", "haiku_agent--s1",
            "hi", timestamp);
    }
}
