package com.ryuqq.agentflow.application.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code agent_run_orchestrator} 입력.
 *
 * @param agentName 에이전트 이름
 * @param sessionId 세션 ID
 * @param operationInput 에이전트 입력 (문자열 또는 구조화 값)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record AgentRunRequest(
    @JsonProperty("agent_name") String agentName,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("operation_input") Object operationInput
) {
}
