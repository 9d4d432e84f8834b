package com.ryuqq.agentflow.core.error;

/**
 * 저장소 또는 버스의 일시적 장애.
 *
 * <p>작업 전체를 재시도해도 안전합니다. 부분 쓰기는 발생하지 않습니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class TransientInfraException extends DurableAgentException {

    public TransientInfraException(String message) {
        super("INFRA-TRANSIENT", message, true);
    }

    public TransientInfraException(String message, Throwable cause) {
        super("INFRA-TRANSIENT", message, true, cause);
    }

    protected TransientInfraException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, true, cause);
    }
}
