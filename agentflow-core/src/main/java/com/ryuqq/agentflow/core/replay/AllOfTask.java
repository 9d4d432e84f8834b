package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.AggregateChildFailureException;
import com.ryuqq.agentflow.core.error.ChildFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * 모든 참가자의 결과가 기록되어야 완료되는 Task.
 *
 * <p>참가자 중 하나라도 실패하면 그 시점에 실패로 해소됩니다.
 * 아직 해소되지 않은 형제 참가자는 취소되지 않습니다.</p>
 *
 * @param <T> 참가자 결과 타입
 * @author Agentflow Team
 * @since 1.0.0
 */
final class AllOfTask<T> extends ReplayTask<List<T>> {

    private final List<ReplayTask<T>> participants;

    AllOfTask(ReplayContext context, List<ReplayTask<T>> participants) {
        super(context);
        this.participants = List.copyOf(participants);
    }

    @Override
    public boolean isDone() {
        return firstFailure() != null || allDone();
    }

    @Override
    public boolean isFailed() {
        return firstFailure() != null;
    }

    @Override
    long completionSequence() {
        ReplayTask<T> failure = firstFailure();
        if (failure != null) {
            return failure.completionSequence();
        }
        long max = -1;
        for (ReplayTask<T> participant : participants) {
            max = Math.max(max, participant.completionSequence());
        }
        return max;
    }

    @Override
    long completionTime() {
        ReplayTask<T> failure = firstFailure();
        if (failure != null) {
            return failure.completionTime();
        }
        long max = Long.MIN_VALUE;
        for (ReplayTask<T> participant : participants) {
            max = Math.max(max, participant.completionTime());
        }
        return max;
    }

    @Override
    List<T> value() {
        List<T> values = new ArrayList<>(participants.size());
        for (ReplayTask<T> participant : participants) {
            values.add(participant.value());
        }
        return values;
    }

    @Override
    RuntimeException failureException() {
        return new AggregateChildFailureException(childFailures());
    }

    @Override
    List<ChildFailure> childFailures() {
        List<ChildFailure> failures = new ArrayList<>();
        for (ReplayTask<T> participant : participants) {
            failures.addAll(participant.childFailures());
        }
        return failures;
    }

    @Override
    boolean waitsForExternalEvent() {
        for (ReplayTask<T> participant : participants) {
            if (participant.waitsForExternalEvent()) {
                return true;
            }
        }
        return false;
    }

    private boolean allDone() {
        for (ReplayTask<T> participant : participants) {
            if (!participant.isDone()) {
                return false;
            }
        }
        return true;
    }

    private ReplayTask<T> firstFailure() {
        ReplayTask<T> first = null;
        for (ReplayTask<T> participant : participants) {
            if (participant.isFailed()
                && (first == null || participant.completionSequence() < first.completionSequence())) {
                first = participant;
            }
        }
        return first;
    }
}
