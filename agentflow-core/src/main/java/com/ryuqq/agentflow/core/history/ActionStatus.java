package com.ryuqq.agentflow.core.history;

/**
 * History 레코드 상태.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public enum ActionStatus {

    SCHEDULED,

    COMPLETED,

    FAILED;

    public boolean isResolution() {
        return this != SCHEDULED;
    }
}
