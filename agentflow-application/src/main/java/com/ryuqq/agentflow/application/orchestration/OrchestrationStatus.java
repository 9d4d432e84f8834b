package com.ryuqq.agentflow.application.orchestration;

import com.ryuqq.agentflow.core.history.InstanceRecord;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;

/**
 * Orchestration 인스턴스 상태 조회 결과.
 *
 * @param instanceId 인스턴스 ID
 * @param name Orchestration 이름
 * @param status 현재 상태
 * @param output 결과 (COMPLETED일 때만, JSON)
 * @param failure 실패 상세 (FAILED일 때만)
 * @param customStatus 사용자 정의 상태 (JSON, null 가능)
 * @param createdAt 생성 시각 (epoch millis)
 * @param lastUpdatedAt 마지막 갱신 시각 (epoch millis)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record OrchestrationStatus(
    InstanceId instanceId,
    String name,
    InstanceStatus status,
    String output,
    FailureDetails failure,
    String customStatus,
    long createdAt,
    long lastUpdatedAt
) {

    /**
     * 요약 레코드로부터 상태 생성.
     */
    public static OrchestrationStatus from(InstanceRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return new OrchestrationStatus(record.instanceId(), record.name(), record.status(), record.output(),
            record.failure(), record.customStatus(), record.createdAt(), record.lastUpdatedAt());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
