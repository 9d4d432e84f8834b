/**
 * 샘플 에이전트 워크플로우.
 *
 * <p>에이전트 목록({@link com.ryuqq.agentflow.samples.AgentCatalog})과
 * 등록 헬퍼({@link com.ryuqq.agentflow.samples.SampleWorkflows})를 제공합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
package com.ryuqq.agentflow.samples;
