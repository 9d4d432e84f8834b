package com.ryuqq.agentflow.core.history;

import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;
import com.ryuqq.agentflow.core.statemachine.StatusTransition;

/**
 * Orchestration 인스턴스 요약 레코드.
 *
 * <p>상태 조회에 사용되며 History append와 같은 원자 단위로 갱신됩니다.
 * 모든 상태 변경 메서드는 {@link StatusTransition}으로 전이를 검증한 새 인스턴스를 반환합니다.</p>
 *
 * @param instanceId 인스턴스 ID
 * @param name Orchestration 이름
 * @param input 입력 (JSON, null 가능)
 * @param status 현재 상태
 * @param output 결과 (COMPLETED일 때만, JSON)
 * @param failure 실패 상세 (FAILED일 때만)
 * @param customStatus 사용자 정의 상태 (JSON, null 가능)
 * @param parent 부모 호출 지점 (최상위 인스턴스는 null)
 * @param createdAt 생성 시각 (epoch millis)
 * @param lastUpdatedAt 마지막 갱신 시각 (epoch millis)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record InstanceRecord(
    InstanceId instanceId,
    String name,
    String input,
    InstanceStatus status,
    String output,
    FailureDetails failure,
    String customStatus,
    ParentLink parent,
    long createdAt,
    long lastUpdatedAt
) {

    public InstanceRecord {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 새 인스턴스 레코드 생성 (RUNNING).
     *
     * @param instanceId 인스턴스 ID
     * @param name Orchestration 이름
     * @param input 입력 (JSON)
     * @param parent 부모 호출 지점 (null 가능)
     * @param now 현재 시각
     * @return RUNNING 상태 레코드
     */
    public static InstanceRecord started(InstanceId instanceId, String name, String input,
                                         ParentLink parent, long now) {
        return new InstanceRecord(instanceId, name, input, InstanceStatus.RUNNING, null, null, null,
            parent, now, now);
    }

    /**
     * 중단 상태로 갱신 (RUNNING 또는 PENDING).
     *
     * @param next RUNNING 또는 PENDING
     * @param customStatus 사용자 정의 상태
     * @param now 현재 시각
     * @return 갱신된 레코드
     * @throws IllegalStateException 종료 상태에서 전이하려는 경우
     */
    public InstanceRecord suspended(InstanceStatus next, String customStatus, long now) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("suspended status cannot be terminal: " + next);
        }
        StatusTransition.validate(status, next);
        return new InstanceRecord(instanceId, name, input, next, null, null, customStatus, parent,
            createdAt, now);
    }

    /**
     * 완료 상태로 갱신.
     */
    public InstanceRecord completed(String output, String customStatus, long now) {
        StatusTransition.validate(status, InstanceStatus.COMPLETED);
        return new InstanceRecord(instanceId, name, input, InstanceStatus.COMPLETED, output, null,
            customStatus, parent, createdAt, now);
    }

    /**
     * 실패 상태로 갱신.
     */
    public InstanceRecord failed(FailureDetails failure, String customStatus, long now) {
        StatusTransition.validate(status, InstanceStatus.FAILED);
        return new InstanceRecord(instanceId, name, input, InstanceStatus.FAILED, null, failure,
            customStatus, parent, createdAt, now);
    }

    /**
     * 상태 변경 없이 갱신 시각만 변경.
     */
    public InstanceRecord touched(long now) {
        return new InstanceRecord(instanceId, name, input, status, output, failure, customStatus,
            parent, createdAt, now);
    }
}
