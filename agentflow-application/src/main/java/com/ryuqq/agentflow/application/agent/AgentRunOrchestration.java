package com.ryuqq.agentflow.application.agent;

import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.OrchestrationContext;

/**
 * 에이전트 세션 한 턴을 실행하는 Orchestration.
 *
 * <p>입력 {@code {agent_name, session_id, operation_input}}으로 세션 엔티티를 한 번 호출하고
 * 응답 텍스트를 그대로 반환합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class AgentRunOrchestration implements Orchestration {

    public static final String NAME = "agent_run_orchestrator";

    @Override
    public Object run(OrchestrationContext ctx) {
        AgentRunRequest request = ctx.getInput(AgentRunRequest.class);
        if (request == null || request.agentName() == null || request.agentName().isBlank()) {
            throw new InputMissingException(NAME);
        }
        return ctx.callAgent(request.agentName(), request.sessionId(), request.operationInput()).await();
    }
}
