package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.application.agent.AgentRunHandle;
import com.ryuqq.agentflow.application.agent.AgentRunOrchestration;
import com.ryuqq.agentflow.application.agent.AgentRunRequest;
import com.ryuqq.agentflow.application.orchestration.OrchestrationClient;
import com.ryuqq.agentflow.application.orchestration.OrchestrationStatus;
import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.model.InstanceId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * InlineFastPathRunner 유닛 테스트.
 *
 * <ul>
 *   <li>timeBudget 이내 완료 → completedFast=true</li>
 *   <li>timeBudget 초과 → 상태 조회 URL</li>
 *   <li>timeBudget 범위 검증</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InlineFastPathRunnerTest {

    private static final InstanceId INSTANCE = InstanceId.of("run-1");

    @Mock
    private OrchestrationClient client;

    @Test
    void runAgent_timeBudget_이내에_완료되면_결과를_즉시_반환함() {
        // given
        InstanceRecord done = InstanceRecord.started(INSTANCE, AgentRunOrchestration.NAME, "{}", null, 1L)
            .completed("\"An old silent pond\"", null, 2L);
        when(client.start(AgentRunOrchestration.NAME, new AgentRunRequest("haiku_agent", "s1", "pond?")))
            .thenReturn(INSTANCE);
        when(client.status(INSTANCE)).thenReturn(Optional.of(OrchestrationStatus.from(done)));
        InlineFastPathRunner runner = new InlineFastPathRunner(client);

        // when
        AgentRunHandle handle = runner.runAgent("haiku_agent", "s1", "pond?", 1000);

        // then
        assertThat(handle.isCompletedFast()).isTrue();
        assertThat(handle.getStatusOrNull().output()).isEqualTo("\"An old silent pond\"");
        assertThat(handle.getStatusUrlOrNull()).isNull();
    }

    @Test
    void runAgent_timeBudget을_넘기면_상태_조회_URL을_반환함() {
        // given
        InstanceRecord running = InstanceRecord.started(INSTANCE, AgentRunOrchestration.NAME, "{}", null, 1L);
        when(client.start(anyString(), any())).thenReturn(INSTANCE);
        when(client.status(INSTANCE)).thenReturn(Optional.of(OrchestrationStatus.from(running)));
        InlineFastPathRunner runner = new InlineFastPathRunner(client);

        // when
        AgentRunHandle handle = runner.runAgent("haiku_agent", "s1", "pond?", 50);

        // then
        assertThat(handle.isCompletedFast()).isFalse();
        assertThat(handle.getStatusUrlOrNull()).isEqualTo("/api/orchestrations/run-1/status");
        verify(client).start(AgentRunOrchestration.NAME, new AgentRunRequest("haiku_agent", "s1", "pond?"));
    }

    @Test
    void runAgent_timeBudget이_범위를_벗어나면_예외() {
        InlineFastPathRunner runner = new InlineFastPathRunner(client);

        assertThatThrownBy(() -> runner.runAgent("haiku_agent", "s1", "pond?", 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeBudgetMs must be between 50 and 180000 ms");
        assertThatThrownBy(() -> runner.runAgent("haiku_agent", "s1", "pond?", 180_001))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(client);
    }

    @Test
    void runAgent_에이전트_이름이_없으면_예외() {
        InlineFastPathRunner runner = new InlineFastPathRunner(client);

        assertThatThrownBy(() -> runner.runAgent(" ", "s1", "pond?", 1000))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
