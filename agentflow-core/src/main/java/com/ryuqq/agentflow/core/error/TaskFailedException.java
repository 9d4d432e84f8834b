package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.outcome.FailureDetails;

/**
 * Orchestration 함수가 기다린 단일 호출이 실패로 기록됨.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class TaskFailedException extends DurableAgentException {

    private final String taskName;
    private final int taskId;
    private final FailureDetails failure;

    public TaskFailedException(String taskName, int taskId, FailureDetails failure) {
        super("ORCH-TASK-FAILED",
            "Task " + taskName + "#" + taskId + " failed: " + failure.errorType() + ": " + failure.message(),
            failure.retryable());
        this.taskName = taskName;
        this.taskId = taskId;
        this.failure = failure;
    }

    public String getTaskName() {
        return taskName;
    }

    public int getTaskId() {
        return taskId;
    }

    public FailureDetails getFailure() {
        return failure;
    }
}
