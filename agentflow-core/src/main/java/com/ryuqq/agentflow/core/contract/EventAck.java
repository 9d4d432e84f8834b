package com.ryuqq.agentflow.core.contract;

import com.ryuqq.agentflow.core.model.InstanceId;

/**
 * raiseEvent 호출 결과.
 *
 * @param eventId 이벤트 ID (거부된 경우 null)
 * @param instanceId 대상 인스턴스 ID
 * @param eventName 이벤트 이름
 * @param accepted 수락 여부
 * @param reason 거부 사유 (수락된 경우 null)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record EventAck(
    String eventId,
    InstanceId instanceId,
    String eventName,
    boolean accepted,
    String reason
) {

    public static EventAck accepted(EventMessage message) {
        return new EventAck(message.eventId(), message.instanceId(), message.eventName(), true, null);
    }

    public static EventAck rejected(InstanceId instanceId, String eventName, String reason) {
        return new EventAck(null, instanceId, eventName, false, reason);
    }
}
