package com.ryuqq.agentflow.core.history;

/**
 * History 레코드 종류.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public enum ActionKind {

    /**
     * 세션 엔티티(에이전트) 호출.
     */
    ENTITY_CALL,

    /**
     * 상태 없는 Activity 호출.
     */
    ACTIVITY_CALL,

    /**
     * 하위 Orchestration 호출.
     */
    SUB_ORCHESTRATION,

    /**
     * 지속 타이머.
     */
    TIMER,

    /**
     * 외부 이벤트 대기 또는 수신.
     */
    EXTERNAL_EVENT;

    /**
     * 다른 컴포넌트로 보내지는 호출인지 확인.
     *
     * @return ENTITY_CALL, ACTIVITY_CALL, SUB_ORCHESTRATION이면 true
     */
    public boolean isCall() {
        return this == ENTITY_CALL || this == ACTIVITY_CALL || this == SUB_ORCHESTRATION;
    }
}
