package com.ryuqq.agentflow.application.agent;

/**
 * run-agent 요청 조정자.
 *
 * <p>{@code agent_run_orchestrator} 인스턴스를 시작하고, 시간 예산 안에 끝나면 결과를,
 * 아니면 상태 조회 URL을 돌려줍니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface AgentRunService {

    /**
     * 에이전트 한 턴을 durable하게 실행.
     *
     * @param agentName 에이전트 이름
     * @param sessionId 세션 ID (빈 값이면 무작위 생성)
     * @param input 입력
     * @param timeBudgetMs 결과를 기다릴 최대 시간 (밀리초)
     * @return AgentRunHandle
     * @throws IllegalArgumentException agentName이 비어 있거나 timeBudgetMs가 허용 범위를 벗어난 경우
     */
    AgentRunHandle runAgent(String agentName, String sessionId, Object input, long timeBudgetMs);
}
