package com.ryuqq.agentflow.core.outcome;

/**
 * Orchestration 함수가 잡히지 않은 예외로 종료됨.
 *
 * @param failure 실패 상세
 * @param customStatus 사용자 정의 상태 (JSON, null 가능)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record Failed(
    FailureDetails failure,
    String customStatus
) implements ReplayOutcome {

    public Failed {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
