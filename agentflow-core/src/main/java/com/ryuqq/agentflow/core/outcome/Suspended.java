package com.ryuqq.agentflow.core.outcome;

import java.util.List;

/**
 * Orchestration 함수가 기록되지 않은 결과를 기다리며 중단됨.
 *
 * <p>{@code newActions}는 이번 재실행에서 처음 도달한 호출 지점 전체이며,
 * fan-out된 호출은 모두 한 번에 포함됩니다.</p>
 *
 * @param newActions 새로 예약할 호출 지점 (빈 리스트 가능)
 * @param awaitingExternalEvent 외부 이벤트를 기다리는 중인지 여부 (PENDING 상태 결정)
 * @param customStatus 사용자 정의 상태 (JSON, null 가능)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record Suspended(
    List<ScheduledAction> newActions,
    boolean awaitingExternalEvent,
    String customStatus
) implements ReplayOutcome {

    public Suspended {
        if (newActions == null) {
            throw new IllegalArgumentException("newActions cannot be null");
        }
        newActions = List.copyOf(newActions);
    }
}
