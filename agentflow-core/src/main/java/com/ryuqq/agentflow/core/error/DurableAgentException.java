package com.ryuqq.agentflow.core.error;

/**
 * Agentflow 도메인 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 오류 코드와 재시도 가능 여부를 가지며,
 * 호출자는 {@link #isRetryable()} 로 동일 입력 재시도 여부를 결정합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>재시도 가능: {@link TransientInfraException}, {@link SessionBusyException}, {@link AdapterException}</li>
 *   <li>재시도 불가: 입력 누락, 알 수 없는 이름, 비결정적 Orchestration 등</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public abstract class DurableAgentException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected DurableAgentException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    protected DurableAgentException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    /**
     * 오류 코드 (예: AGENT-ADAPTER, INFRA-TRANSIENT).
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 동일 입력으로 재시도하면 성공할 가능성이 있는지 여부.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
