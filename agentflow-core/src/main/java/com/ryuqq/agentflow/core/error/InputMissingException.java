package com.ryuqq.agentflow.core.error;

/**
 * 필수 입력 없이 Orchestration이 시작됨.
 *
 * <p>어떤 호출도 예약되기 전에 즉시 실패합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class InputMissingException extends DurableAgentException {

    public InputMissingException(String orchestrationName) {
        super("ORCH-INPUT-MISSING", "Input missing for orchestration " + orchestrationName, false);
    }
}
