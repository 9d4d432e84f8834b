package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.ChildFailure;
import com.ryuqq.agentflow.core.error.TaskFailedException;
import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.ActionStatus;
import com.ryuqq.agentflow.core.history.HistoryEvent;

import java.util.List;
import java.util.function.Function;

/**
 * 단일 호출 지점 Task.
 *
 * @param <V> 결과 타입
 * @author Agentflow Team
 * @since 1.0.0
 */
final class CallTask<V> extends ReplayTask<V> {

    private final int taskId;
    private final ActionKind kind;
    private final String name;
    private final HistoryEvent resolution;
    private final Function<String, V> decoder;

    CallTask(ReplayContext context, int taskId, ActionKind kind, String name,
             HistoryEvent resolution, Function<String, V> decoder) {
        super(context);
        this.taskId = taskId;
        this.kind = kind;
        this.name = name;
        this.resolution = resolution;
        this.decoder = decoder;
    }

    @Override
    public boolean isDone() {
        return resolution != null;
    }

    @Override
    public boolean isFailed() {
        return resolution != null && resolution.status() == ActionStatus.FAILED;
    }

    @Override
    long completionSequence() {
        return resolution.sequenceNo();
    }

    @Override
    long completionTime() {
        return resolution.timestamp();
    }

    @Override
    V value() {
        return decoder.apply(resolution.payload());
    }

    @Override
    RuntimeException failureException() {
        return new TaskFailedException(name, taskId, resolution.failure());
    }

    @Override
    List<ChildFailure> childFailures() {
        return isFailed() ? List.of(new ChildFailure(taskId, name, resolution.failure())) : List.of();
    }

    @Override
    boolean waitsForExternalEvent() {
        return resolution == null && kind == ActionKind.EXTERNAL_EVENT;
    }
}
