package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.model.InstanceId;

/**
 * 인스턴스 History가 설정된 최대 크기를 초과함.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class HistoryLimitExceededException extends DurableAgentException {

    public HistoryLimitExceededException(InstanceId instanceId, int limit) {
        super("ORCH-HISTORY-LIMIT",
            "History of " + instanceId.getValue() + " would exceed " + limit + " events", false);
    }
}
