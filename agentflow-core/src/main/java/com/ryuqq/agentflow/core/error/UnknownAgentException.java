package com.ryuqq.agentflow.core.error;

/**
 * 등록되지 않은 에이전트 이름.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class UnknownAgentException extends DurableAgentException {

    public UnknownAgentException(String agentName) {
        super("AGENT-UNKNOWN", "Agent " + agentName + " not found", false);
    }
}
