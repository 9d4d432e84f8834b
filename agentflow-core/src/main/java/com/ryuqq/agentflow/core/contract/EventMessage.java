package com.ryuqq.agentflow.core.contract;

import com.ryuqq.agentflow.core.model.InstanceId;

import java.util.UUID;

/**
 * 외부 이벤트 전달 메시지.
 *
 * <p>Event Bus를 통해 전달되며, {@code eventId}는 재전달 시에도 유지되어
 * 엔진이 중복 수신을 무시하는 기준이 됩니다.</p>
 *
 * @param eventId 중복 제거 키
 * @param instanceId 대상 인스턴스 ID
 * @param eventName 이벤트 이름
 * @param payload 이벤트 데이터 (JSON, null 가능)
 * @param attempt 전달 시도 횟수 (1부터 시작)
 * @param raisedAt 발생 시각 (epoch millis)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record EventMessage(
    String eventId,
    InstanceId instanceId,
    String eventName,
    String payload,
    int attempt,
    long raisedAt
) {

    public EventMessage {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    /**
     * 새 이벤트 메시지 생성 (첫 시도, 무작위 eventId).
     *
     * @param instanceId 대상 인스턴스 ID
     * @param eventName 이벤트 이름
     * @param payload 이벤트 데이터 (JSON)
     * @return EventMessage 인스턴스
     */
    public static EventMessage create(InstanceId instanceId, String eventName, String payload) {
        return new EventMessage(UUID.randomUUID().toString(), instanceId, eventName, payload, 1,
            System.currentTimeMillis());
    }

    /**
     * 재전달용 메시지 생성 (attempt + 1, eventId 유지).
     *
     * @return 다음 시도 메시지
     */
    public EventMessage nextAttempt() {
        return new EventMessage(eventId, instanceId, eventName, payload, attempt + 1, raisedAt);
    }
}
