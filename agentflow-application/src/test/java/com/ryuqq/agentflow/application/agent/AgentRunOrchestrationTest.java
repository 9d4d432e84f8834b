package com.ryuqq.agentflow.application.agent;

import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.outcome.Completed;
import com.ryuqq.agentflow.core.outcome.Failed;
import com.ryuqq.agentflow.core.outcome.ReplayOutcome;
import com.ryuqq.agentflow.core.outcome.Suspended;
import com.ryuqq.agentflow.core.replay.ReplayContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AgentRunOrchestration 유닛 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class AgentRunOrchestrationTest {

    private static final JsonCodec JSON = JsonCodec.defaultCodec();

    private final AgentRunOrchestration orchestration = new AgentRunOrchestration();

    @Test
    void 요청한_세션으로_에이전트를_한_번_호출한다() {
        // given
        InstanceRecord instance = instanceWith(new AgentRunRequest("haiku_agent", "s1", "rain"));

        // when
        ReplayOutcome outcome = ReplayContext.replay(orchestration, instance, List.of(), JSON);

        // then
        assertThat(outcome).isInstanceOf(Suspended.class);
        Suspended suspended = (Suspended) outcome;
        assertThat(suspended.newActions()).hasSize(1);
        assertThat(suspended.newActions().get(0).kind()).isEqualTo(ActionKind.ENTITY_CALL);
        assertThat(suspended.newActions().get(0).target()).isEqualTo("haiku_agent--s1");
        assertThat(suspended.newActions().get(0).input()).isEqualTo("rain");
    }

    @Test
    void 에이전트_응답을_결과로_반환한다() {
        // given
        InstanceRecord instance = instanceWith(new AgentRunRequest("haiku_agent", "s1", "rain"));
        List<HistoryEvent> history = List.of(
            HistoryEvent.scheduled(0, 0, ActionKind.ENTITY_CALL, "haiku_agent", "haiku_agent--s1", "rain", 1L),
            HistoryEvent.completed(1, 0, ActionKind.ENTITY_CALL, "haiku_agent", "\"Soft rain\"", 2L));

        // when
        ReplayOutcome outcome = ReplayContext.replay(orchestration, instance, history, JSON);

        // then
        assertThat(outcome).isInstanceOf(Completed.class);
        assertThat(((Completed) outcome).output()).isEqualTo("\"Soft rain\"");
    }

    @Test
    void 구조화_operation_input은_JSON으로_전달된다() {
        // given
        InstanceRecord instance = instanceWith(Map.of(
            "agent_name", "weather_agent",
            "session_id", "s1",
            "operation_input", Map.of("city", "Seoul")));

        // when
        Suspended suspended = (Suspended) ReplayContext.replay(orchestration, instance, List.of(), JSON);

        // then
        assertThat(suspended.newActions().get(0).input()).isEqualTo("{\"city\":\"Seoul\"}");
    }

    @Test
    void agent_name이_없으면_InputMissing으로_실패한다() {
        // given
        InstanceRecord instance = instanceWith(Map.of("session_id", "s1"));

        // when
        ReplayOutcome outcome = ReplayContext.replay(orchestration, instance, List.of(), JSON);

        // then
        assertThat(outcome).isInstanceOf(Failed.class);
        assertThat(((Failed) outcome).failure().errorType()).isEqualTo("InputMissingException");
    }

    private InstanceRecord instanceWith(Object input) {
        return InstanceRecord.started(InstanceId.of("run-1"), AgentRunOrchestration.NAME, JSON.toJson(input), null, 1L);
    }
}
