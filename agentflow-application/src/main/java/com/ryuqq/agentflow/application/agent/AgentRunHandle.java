package com.ryuqq.agentflow.application.agent;

import com.ryuqq.agentflow.application.orchestration.OrchestrationStatus;
import com.ryuqq.agentflow.core.model.InstanceId;

/**
 * run-agent 요청 핸들.
 *
 * <p>시간 예산 안에 끝났는지에 따라 응답 전략이 갈립니다.</p>
 *
 * <ul>
 *   <li><strong>완료 (completedFast = true):</strong> 최종 상태(결과 또는 실패)를 즉시 반환</li>
 *   <li><strong>비동기 전환 (completedFast = false):</strong> 상태 조회 URL 반환
 *       (예: /api/orchestrations/{instanceId}/status)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AgentRunHandle handle = service.runAgent("haiku_agent", sessionId, "rain", 500);
 * if (handle.isCompletedFast()) {
 *     String reply = handle.getStatusOrNull().output();
 * } else {
 *     String url = handle.getStatusUrlOrNull();
 * }
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class AgentRunHandle {

    private final InstanceId instanceId;
    private final boolean completedFast;
    private final OrchestrationStatus statusOrNull;
    private final String statusUrlOrNull;

    private AgentRunHandle(InstanceId instanceId, boolean completedFast,
                           OrchestrationStatus statusOrNull, String statusUrlOrNull) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        this.instanceId = instanceId;
        this.completedFast = completedFast;
        this.statusOrNull = statusOrNull;
        this.statusUrlOrNull = statusUrlOrNull;
    }

    /**
     * 시간 예산 안에 종료된 핸들 생성.
     *
     * @param instanceId 인스턴스 ID
     * @param status 종료 상태
     * @return AgentRunHandle (completedFast=true)
     * @throws IllegalArgumentException status가 null이거나 종료 상태가 아닌 경우
     */
    public static AgentRunHandle completed(InstanceId instanceId, OrchestrationStatus status) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal for completed handle");
        }
        return new AgentRunHandle(instanceId, true, status, null);
    }

    /**
     * 비동기 전환 핸들 생성.
     *
     * @param instanceId 인스턴스 ID
     * @param statusUrl 상태 조회 URL
     * @return AgentRunHandle (completedFast=false)
     * @throws IllegalArgumentException statusUrl이 null/blank인 경우
     */
    public static AgentRunHandle async(InstanceId instanceId, String statusUrl) {
        if (statusUrl == null || statusUrl.isBlank()) {
            throw new IllegalArgumentException("statusUrl cannot be null or blank for async handle");
        }
        return new AgentRunHandle(instanceId, false, null, statusUrl);
    }

    public InstanceId getInstanceId() {
        return instanceId;
    }

    public boolean isCompletedFast() {
        return completedFast;
    }

    /**
     * 종료 상태 조회 (completedFast=true인 경우에만 non-null).
     */
    public OrchestrationStatus getStatusOrNull() {
        return statusOrNull;
    }

    /**
     * 상태 조회 URL (completedFast=false인 경우에만 non-null).
     */
    public String getStatusUrlOrNull() {
        return statusUrlOrNull;
    }

    @Override
    public String toString() {
        if (completedFast) {
            return "AgentRunHandle{instanceId=" + instanceId + ", completed=true, status=" + statusOrNull.status() + "}";
        }
        return "AgentRunHandle{instanceId=" + instanceId + ", completed=false, statusUrl=" + statusUrlOrNull + "}";
    }
}
