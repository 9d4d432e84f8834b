package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.outcome.FailureDetails;

/**
 * fan-out 참가자 하나의 실패 정보.
 *
 * @param taskId 호출 지점 번호 (조합 Task인 경우 -1)
 * @param name 호출 대상 이름
 * @param failure 실패 상세
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record ChildFailure(
    int taskId,
    String name,
    FailureDetails failure
) {

    public ChildFailure {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
