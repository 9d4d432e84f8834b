package com.ryuqq.agentflow.core.error;

/**
 * 재실행(replay) 중 함수가 History와 다른 호출 순서를 만듦.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class NonDeterministicOrchestrationException extends DurableAgentException {

    public NonDeterministicOrchestrationException(int taskId, String recorded, String replayed) {
        super("ORCH-NONDETERMINISTIC",
            "Call site #" + taskId + " was recorded as " + recorded + " but replay produced " + replayed, false);
    }
}
