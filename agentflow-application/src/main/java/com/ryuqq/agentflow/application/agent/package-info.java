/**
 * Agent-facing client ports.
 *
 * <p>{@link com.ryuqq.agentflow.application.agent.AgentGateway} runs a session turn directly;
 * {@link com.ryuqq.agentflow.application.agent.AgentRunService} runs it durably through the
 * {@code agent_run_orchestrator} workflow with a time budget.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.application.agent;
