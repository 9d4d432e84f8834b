package com.ryuqq.agentflow.core.error;

/**
 * 등록되지 않은 Orchestration 또는 Activity 이름.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class UnknownOrchestrationException extends DurableAgentException {

    public UnknownOrchestrationException(String kind, String name) {
        super("ORCH-UNKNOWN", kind + " " + name + " not found", false);
    }
}
