package com.ryuqq.agentflow.core.outcome;

/**
 * Orchestration 함수가 값을 반환함.
 *
 * @param output 반환값 (JSON)
 * @param customStatus 사용자 정의 상태 (JSON, null 가능)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record Completed(
    String output,
    String customStatus
) implements ReplayOutcome {

    public Completed {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }
}
