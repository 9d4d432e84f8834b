/**
 * Runner Adapter Layer - 세션 디스패처, Orchestration Engine, 이벤트 워커, 복구.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentflow.adapter.runner.SessionEntityDispatcher} - 세션별 직렬 실행 (AgentGateway)</li>
 *   <li>{@link com.ryuqq.agentflow.adapter.runner.DurableOrchestrationRunner} - 재실행 기반 엔진 (OrchestrationClient)</li>
 *   <li>{@link com.ryuqq.agentflow.adapter.runner.EventDeliveryWorker} - Event Bus 소비자 (Runtime)</li>
 *   <li>{@link com.ryuqq.agentflow.adapter.runner.InstanceReaper} - 재시작 후 복구</li>
 *   <li>{@link com.ryuqq.agentflow.adapter.runner.InlineFastPathRunner} - timeBudget 기반 에이전트 실행 (AgentRunService)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner
 *   ↓ implements
 * application (AgentGateway, OrchestrationClient, Runtime, AgentRunService)
 *   ↓ depends on
 * core (ReplayContext, History, SPI)
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
package com.ryuqq.agentflow.adapter.runner;
