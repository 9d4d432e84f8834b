package com.ryuqq.agentflow.core.outcome;

import com.ryuqq.agentflow.core.history.ActionKind;

/**
 * 한 번의 재실행(replay)에서 새로 발견된 호출 지점.
 *
 * <p>엔진은 이 값을 SCHEDULED History 레코드로 먼저 저장한 뒤에만 실제 호출을 보냅니다.</p>
 *
 * @param taskId 호출 지점 번호 (0부터 증가)
 * @param kind 호출 종류
 * @param name 에이전트/Activity/Orchestration/이벤트 이름
 * @param target 종류별 대상 (세션 키, 하위 인스턴스 ID, 타이머 만료 시각)
 * @param input 입력 (에이전트 호출은 원문, 그 외는 JSON)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record ScheduledAction(
    int taskId,
    ActionKind kind,
    String name,
    String target,
    String input
) {

    public ScheduledAction {
        if (taskId < 0) {
            throw new IllegalArgumentException("taskId cannot be negative (current: " + taskId + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
