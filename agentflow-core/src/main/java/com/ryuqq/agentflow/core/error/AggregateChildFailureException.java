package com.ryuqq.agentflow.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * "wait all" 대상 중 하나 이상이 실패함.
 *
 * <p>실패한 모든 참가자의 오류를 하나의 예외로 모읍니다.
 * 성공한 형제 참가자의 기록은 영향을 받지 않습니다.
 * 모든 참가자의 실패가 재시도 가능한 경우에만 재시도 가능으로 분류됩니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class AggregateChildFailureException extends DurableAgentException {

    private final List<ChildFailure> failures;

    public AggregateChildFailureException(List<ChildFailure> failures) {
        super("ORCH-AGGREGATE", buildMessage(failures), allRetryable(failures));
        this.failures = List.copyOf(failures);
    }

    public List<ChildFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(List<ChildFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        return failures.size() + " of the awaited tasks failed: " + failures.stream()
            .map(f -> f.name() + "#" + f.taskId() + " (" + f.failure().errorType() + ": " + f.failure().message() + ")")
            .collect(Collectors.joining(", "));
    }

    private static boolean allRetryable(List<ChildFailure> failures) {
        return failures.stream().allMatch(f -> f.failure().retryable());
    }
}
