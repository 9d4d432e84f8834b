package com.ryuqq.agentflow.adapter.runner;

/**
 * InstanceReaper 리컨실 전략.
 *
 * <p>SCHEDULED 상태로 오래 남은 호출 레코드(프로세스 재시작 등으로 결과가 유실된 호출)를
 * 어떻게 처리할지 결정합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 호출을 다시 실행합니다.
     *
     * <p>에이전트 세션이나 Activity가 같은 입력을 두 번 처리할 수 있습니다.</p>
     */
    RETRY,

    /**
     * 호출 지점에 FAILED 레코드를 기록합니다.
     *
     * <p>Orchestration은 {@code TaskFailedException}을 받고 스스로 처리 여부를 결정합니다.</p>
     */
    FAIL
}
