/**
 * 사람 승인 단계를 포함한 여행 계획 워크플로우.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
package com.ryuqq.agentflow.samples.travel;
