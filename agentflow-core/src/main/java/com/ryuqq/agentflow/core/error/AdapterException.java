package com.ryuqq.agentflow.core.error;

import com.ryuqq.agentflow.core.model.SessionKey;

/**
 * Agent Runner 호출 실패.
 *
 * <p>세션 상태는 변경되지 않습니다 (쓰기는 성공 시에만 수행).
 * 호출자는 동일 입력으로 재시도할지 결정합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class AdapterException extends DurableAgentException {

    private final SessionKey sessionKey;

    public AdapterException(SessionKey sessionKey, Throwable cause) {
        super("AGENT-ADAPTER",
            "Agent run failed for session " + sessionKey.asString() + ": " + describe(cause), true, cause);
        this.sessionKey = sessionKey;
    }

    public SessionKey getSessionKey() {
        return sessionKey;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
