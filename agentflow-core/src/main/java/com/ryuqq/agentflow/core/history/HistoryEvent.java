package com.ryuqq.agentflow.core.history;

import com.ryuqq.agentflow.core.outcome.FailureDetails;

/**
 * Orchestration 인스턴스의 append-only History 레코드.
 *
 * <p>호출 지점은 SCHEDULED 레코드로 시작하고, 같은 taskId의 COMPLETED 또는 FAILED
 * 레코드로 해소됩니다. 전달된 외부 이벤트는 taskId {@value #NO_TASK}인 COMPLETED
 * EXTERNAL_EVENT 레코드로 도착 순서대로 쌓입니다.</p>
 *
 * <p><strong>target 필드:</strong></p>
 * <ul>
 *   <li>ENTITY_CALL: 세션 키 ({@code agentName--sessionId})</li>
 *   <li>SUB_ORCHESTRATION: 하위 인스턴스 ID</li>
 *   <li>TIMER: 만료 시각 (epoch millis)</li>
 * </ul>
 *
 * @param sequenceNo 인스턴스 내 순번 (0부터 연속)
 * @param taskId 호출 지점 번호 (수신 이벤트는 -1)
 * @param kind 레코드 종류
 * @param name 호출 대상 또는 이벤트 이름
 * @param target 종류별 대상 (null 가능)
 * @param status 레코드 상태
 * @param payload SCHEDULED는 입력, COMPLETED는 결과 JSON (null 가능)
 * @param failure FAILED 레코드의 실패 상세 (그 외 null)
 * @param eventId 수신 이벤트의 중복 제거 키 (그 외 null)
 * @param timestamp 기록 시각 (epoch millis)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record HistoryEvent(
    long sequenceNo,
    int taskId,
    ActionKind kind,
    String name,
    String target,
    ActionStatus status,
    String payload,
    FailureDetails failure,
    String eventId,
    long timestamp
) {

    /**
     * 수신 이벤트 레코드의 taskId.
     */
    public static final int NO_TASK = -1;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 누락되었거나 상태와 필드가 맞지 않는 경우
     */
    public HistoryEvent {
        if (sequenceNo < 0) {
            throw new IllegalArgumentException("sequenceNo cannot be negative (current: " + sequenceNo + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (status == ActionStatus.FAILED && failure == null) {
            throw new IllegalArgumentException("failure cannot be null for FAILED record");
        }
        if (taskId < NO_TASK) {
            throw new IllegalArgumentException("taskId must be >= -1 (current: " + taskId + ")");
        }
    }

    /**
     * SCHEDULED 레코드 생성.
     */
    public static HistoryEvent scheduled(long sequenceNo, int taskId, ActionKind kind, String name,
                                         String target, String input, long timestamp) {
        return new HistoryEvent(sequenceNo, taskId, kind, name, target, ActionStatus.SCHEDULED,
            input, null, null, timestamp);
    }

    /**
     * COMPLETED 레코드 생성.
     */
    public static HistoryEvent completed(long sequenceNo, int taskId, ActionKind kind, String name,
                                         String payload, long timestamp) {
        return new HistoryEvent(sequenceNo, taskId, kind, name, null, ActionStatus.COMPLETED,
            payload, null, null, timestamp);
    }

    /**
     * FAILED 레코드 생성.
     */
    public static HistoryEvent failed(long sequenceNo, int taskId, ActionKind kind, String name,
                                      FailureDetails failure, long timestamp) {
        return new HistoryEvent(sequenceNo, taskId, kind, name, null, ActionStatus.FAILED,
            null, failure, null, timestamp);
    }

    /**
     * 외부 이벤트 수신 레코드 생성.
     *
     * @param sequenceNo 순번
     * @param eventName 이벤트 이름
     * @param payload 이벤트 데이터 (JSON)
     * @param eventId 중복 제거 키
     * @param timestamp 수신 시각
     * @return COMPLETED EXTERNAL_EVENT 레코드
     */
    public static HistoryEvent eventReceived(long sequenceNo, String eventName, String payload,
                                             String eventId, long timestamp) {
        return new HistoryEvent(sequenceNo, NO_TASK, ActionKind.EXTERNAL_EVENT, eventName, null,
            ActionStatus.COMPLETED, payload, null, eventId, timestamp);
    }

    /**
     * 외부 이벤트 수신 레코드인지 확인.
     *
     * @return taskId가 없는 EXTERNAL_EVENT 레코드이면 true
     */
    public boolean isReceivedEvent() {
        return kind == ActionKind.EXTERNAL_EVENT && taskId == NO_TASK;
    }
}
