package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.model.InstanceId;

/**
 * 존재하지 않거나 이미 종료된 인스턴스로 외부 이벤트가 전달됨.
 *
 * <p>로그로 남기고 Orchestration으로 전파하지 않는 soft failure입니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class EventMismatchException extends DurableAgentException {

    private final InstanceId instanceId;
    private final String eventName;

    public EventMismatchException(InstanceId instanceId, String eventName, String reason) {
        super("EVENT-MISMATCH",
            "Event '" + eventName + "' cannot be delivered to " + instanceId.getValue() + ": " + reason, false);
        this.instanceId = instanceId;
        this.eventName = eventName;
    }

    public InstanceId getInstanceId() {
        return instanceId;
    }

    public String getEventName() {
        return eventName;
    }
}
