package com.ryuqq.agentflow.core.replay;

/**
 * 기록되지 않은 결과를 기다릴 때 Orchestration 함수를 빠져나오는 신호.
 *
 * <p>{@link Error}를 상속하므로 함수 안의 {@code catch (Exception e)}에 잡히지 않습니다.
 * 스택 트레이스는 만들지 않습니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
final class OrchestrationSuspendedSignal extends Error {

    private static final long serialVersionUID = 1L;

    private final boolean awaitingExternalEvent;

    OrchestrationSuspendedSignal(boolean awaitingExternalEvent) {
        super("Orchestration suspended", null, false, false);
        this.awaitingExternalEvent = awaitingExternalEvent;
    }

    boolean isAwaitingExternalEvent() {
        return awaitingExternalEvent;
    }
}
