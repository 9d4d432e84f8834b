package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.ChildFailure;
import com.ryuqq.agentflow.core.orchestration.Task;

import java.util.List;

/**
 * History에서 결과를 읽는 Task의 공통 구현.
 *
 * @param <V> 결과 타입
 * @author Agentflow Team
 * @since 1.0.0
 */
abstract class ReplayTask<V> implements Task<V> {

    private final ReplayContext context;

    ReplayTask(ReplayContext context) {
        this.context = context;
    }

    ReplayContext context() {
        return context;
    }

    @Override
    public final V await() {
        if (!isDone()) {
            throw context.suspend(this);
        }
        context.advanceClock(completionTime());
        if (isFailed()) {
            throw failureException();
        }
        return value();
    }

    /**
     * 해소 레코드의 순번 (anyOf 승자 결정 기준).
     */
    abstract long completionSequence();

    /**
     * 해소 레코드의 기록 시각.
     */
    abstract long completionTime();

    abstract V value();

    abstract RuntimeException failureException();

    abstract List<ChildFailure> childFailures();

    /**
     * 아직 전달되지 않은 외부 이벤트를 기다리는지 확인.
     */
    abstract boolean waitsForExternalEvent();
}
