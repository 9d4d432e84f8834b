package com.ryuqq.agentflow.core.statemachine;

/**
 * 인스턴스 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RUNNING ↔ PENDING</li>
 *   <li>RUNNING, PENDING → COMPLETED</li>
 *   <li>RUNNING, PENDING → FAILED</li>
 *   <li>비종료 상태에서 동일 상태 유지 (no-op)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(InstanceStatus from, InstanceStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        // 비종료 상태에서는 모든 상태로 전이 가능 (RUNNING/PENDING 간 왕복 포함)
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static InstanceStatus transition(InstanceStatus current, InstanceStatus next) {
        validate(current, next);
        return next;
    }
}
