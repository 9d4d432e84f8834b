package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.model.SessionKey;

/**
 * 세션의 대기열이 가득 차 run 호출을 수락할 수 없음 (back-pressure).
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class SessionBusyException extends TransientInfraException {

    private final SessionKey sessionKey;

    public SessionBusyException(SessionKey sessionKey, int maxQueued, Throwable cause) {
        super("SESSION-BUSY",
            "Session " + sessionKey.asString() + " already has " + maxQueued + " queued run calls", cause);
        this.sessionKey = sessionKey;
    }

    public SessionKey getSessionKey() {
        return sessionKey;
    }
}
