package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.application.agent.AgentRunHandle;
import com.ryuqq.agentflow.application.agent.AgentRunOrchestration;
import com.ryuqq.agentflow.application.agent.AgentRunRequest;
import com.ryuqq.agentflow.application.agent.AgentRunService;
import com.ryuqq.agentflow.application.orchestration.OrchestrationClient;
import com.ryuqq.agentflow.application.orchestration.OrchestrationStatus;
import com.ryuqq.agentflow.core.model.InstanceId;

import java.util.Optional;

/**
 * Inline Fast-Path Runner 구현체.
 *
 * <p>{@code agent_run_orchestrator} 인스턴스를 시작하고 timeBudget 동안 완료를 기다립니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>{@code {agent_name, session_id, operation_input}} 입력으로 인스턴스 시작</li>
 *   <li>timeBudget 동안 소프트 폴링 (10ms 간격)</li>
 *   <li>완료 시: AgentRunHandle(completedFast=true, status)</li>
 *   <li>타임아웃 시: AgentRunHandle(completedFast=false, statusUrl)</li>
 * </ol>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class InlineFastPathRunner implements AgentRunService {

    private static final long MIN_TIME_BUDGET_MS = 50;
    private static final long MAX_TIME_BUDGET_MS = 180_000;
    private static final long DEFAULT_POLLING_INTERVAL_MS = 10;

    private final OrchestrationClient client;
    private final long pollingIntervalMs;

    public InlineFastPathRunner(OrchestrationClient client) {
        this(client, DEFAULT_POLLING_INTERVAL_MS);
    }

    /**
     * 생성자 (폴링 간격 커스터마이징).
     *
     * @param client Orchestration client
     * @param pollingIntervalMs 폴링 간격 (밀리초)
     * @throws IllegalArgumentException client가 null이거나 pollingIntervalMs가 양수가 아닌 경우
     */
    public InlineFastPathRunner(OrchestrationClient client, long pollingIntervalMs) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException("pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")");
        }
        this.client = client;
        this.pollingIntervalMs = pollingIntervalMs;
    }

    @Override
    public AgentRunHandle runAgent(String agentName, String sessionId, Object input, long timeBudgetMs) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        if (timeBudgetMs < MIN_TIME_BUDGET_MS || timeBudgetMs > MAX_TIME_BUDGET_MS) {
            throw new IllegalArgumentException(
                String.format("timeBudgetMs must be between %d and %d ms (current: %d)",
                    MIN_TIME_BUDGET_MS, MAX_TIME_BUDGET_MS, timeBudgetMs));
        }

        InstanceId instanceId = client.start(AgentRunOrchestration.NAME,
            new AgentRunRequest(agentName, sessionId, input));
        return pollForCompletion(instanceId, timeBudgetMs);
    }

    private AgentRunHandle pollForCompletion(InstanceId instanceId, long timeBudgetMs) {
        long startTimeNanos = System.nanoTime();
        long timeBudgetNanos = timeBudgetMs * 1_000_000L;

        while (System.nanoTime() - startTimeNanos < timeBudgetNanos) {
            Optional<OrchestrationStatus> status = client.status(instanceId);
            if (status.isPresent() && status.get().isTerminal()) {
                return AgentRunHandle.completed(instanceId, status.get());
            }
            sleep(pollingIntervalMs);
        }

        return AgentRunHandle.async(instanceId, buildStatusUrl(instanceId));
    }

    private String buildStatusUrl(InstanceId instanceId) {
        return "/api/orchestrations/" + instanceId.getValue() + "/status";
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
