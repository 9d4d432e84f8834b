package com.ryuqq.agentflow.application.session;

import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.agent.AgentReply;
import com.ryuqq.agentflow.core.error.UnknownAgentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AgentRegistry 유닛 테스트.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
class AgentRegistryTest {

    private final AgentDefinition<?> haiku =
        AgentDefinition.transcript("haiku_agent", (state, input) -> new AgentReply<>(state, "ok"));

    @Test
    void 등록한_에이전트를_이름으로_조회한다() {
        // given
        AgentRegistry registry = AgentRegistry.builder().register(haiku).build();

        // then
        assertThat(registry.get("haiku_agent")).isSameAs(haiku);
        assertThat(registry.contains("haiku_agent")).isTrue();
        assertThat(registry.names()).containsExactly("haiku_agent");
    }

    @Test
    void 같은_이름을_두_번_등록하면_실패한다() {
        AgentRegistry.Builder builder = AgentRegistry.builder().register(haiku);

        assertThatThrownBy(() -> builder.register(haiku))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void 등록되지_않은_이름은_재시도_불가_오류다() {
        AgentRegistry registry = AgentRegistry.builder().build();

        assertThatThrownBy(() -> registry.get("ghost_agent"))
            .isInstanceOf(UnknownAgentException.class)
            .satisfies(e -> assertThat(((UnknownAgentException) e).isRetryable()).isFalse());
    }
}
