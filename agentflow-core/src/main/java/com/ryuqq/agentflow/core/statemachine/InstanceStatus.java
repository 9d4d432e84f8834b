package com.ryuqq.agentflow.core.statemachine;

/**
 * Orchestration 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING ◄──────► PENDING (외부 이벤트 대기)
 *    │                │
 *    ├─► COMPLETED ◄──┤
 *    │                │
 *    └─► FAILED ◄─────┘
 *
 * 금지된 전이:
 * - COMPLETED → * ❌
 * - FAILED → * ❌
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public enum InstanceStatus {

    /**
     * 실행 중 (호출 결과 대기 포함).
     */
    RUNNING,

    /**
     * 외부 이벤트(예: 사람의 승인) 대기 중.
     */
    PENDING,

    /**
     * 완료 (함수가 값을 반환).
     */
    COMPLETED,

    /**
     * 실패 (함수에서 처리되지 않은 예외 발생).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
