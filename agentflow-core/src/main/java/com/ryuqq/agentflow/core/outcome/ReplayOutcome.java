package com.ryuqq.agentflow.core.outcome;

/**
 * Orchestration 함수 한 번의 재실행 결과.
 *
 * <p>세 가지 결과 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Completed}: 함수가 값을 반환함</li>
 *   <li>{@link Suspended}: 아직 기록되지 않은 결과를 기다리며 중단됨</li>
 *   <li>{@link Failed}: 함수가 예외를 던졌거나 비결정적 실행이 감지됨</li>
 * </ul>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Completed completed) {
 *     finish(completed.output());
 * } else if (outcome instanceof Suspended suspended) {
 *     schedule(suspended.newActions());
 * } else if (outcome instanceof Failed failed) {
 *     fail(failed.failure());
 * }
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public sealed interface ReplayOutcome permits Completed, Suspended, Failed {

    /**
     * 함수가 마지막으로 설정한 사용자 정의 상태 (JSON, 없으면 null).
     *
     * @return 사용자 정의 상태
     */
    String customStatus();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isSuspended() {
        return this instanceof Suspended;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }
}
