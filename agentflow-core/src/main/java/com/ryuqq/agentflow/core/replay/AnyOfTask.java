package com.ryuqq.agentflow.core.replay;

import com.ryuqq.agentflow.core.error.ChildFailure;
import com.ryuqq.agentflow.core.orchestration.Task;

import java.util.List;

/**
 * 가장 먼저 해소된 참가자를 결과로 돌려주는 Task.
 *
 * <p>승자는 해소 레코드의 순번이 가장 작은 참가자입니다. 승자가 실패했더라도
 * 이 Task 자체는 실패하지 않으며, 호출자가 승자를 await할 때 실패가 드러납니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
final class AnyOfTask extends ReplayTask<Task<?>> {

    private final List<ReplayTask<?>> participants;

    AnyOfTask(ReplayContext context, List<ReplayTask<?>> participants) {
        super(context);
        this.participants = List.copyOf(participants);
    }

    @Override
    public boolean isDone() {
        return winner() != null;
    }

    @Override
    public boolean isFailed() {
        return false;
    }

    @Override
    long completionSequence() {
        return winner().completionSequence();
    }

    @Override
    long completionTime() {
        return winner().completionTime();
    }

    @Override
    Task<?> value() {
        return winner();
    }

    @Override
    RuntimeException failureException() {
        throw new IllegalStateException("anyOf never fails");
    }

    @Override
    List<ChildFailure> childFailures() {
        return List.of();
    }

    @Override
    boolean waitsForExternalEvent() {
        for (ReplayTask<?> participant : participants) {
            if (participant.waitsForExternalEvent()) {
                return true;
            }
        }
        return false;
    }

    private ReplayTask<?> winner() {
        ReplayTask<?> winner = null;
        for (ReplayTask<?> participant : participants) {
            if (participant.isDone()
                && (winner == null || participant.completionSequence() < winner.completionSequence())) {
                winner = participant;
            }
        }
        return winner;
    }
}
