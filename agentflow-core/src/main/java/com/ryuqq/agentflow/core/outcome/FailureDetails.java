package com.ryuqq.agentflow.core.outcome;

import com.ryuqq.agentflow.core.error.DurableAgentException;

/**
 * 실패 상세 정보.
 *
 * <p>History 레코드와 Orchestration 상태 조회 결과에 그대로 기록됩니다.</p>
 *
 * @param errorType 오류 유형 (예외 클래스 단순 이름)
 * @param message 오류 메시지
 * @param retryable 재시도 가능 여부
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record FailureDetails(
    String errorType,
    String message,
    boolean retryable
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorType이 null이거나 빈 문자열인 경우
     */
    public FailureDetails {
        if (errorType == null || errorType.isBlank()) {
            throw new IllegalArgumentException("errorType cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * 예외로부터 FailureDetails 생성.
     *
     * <p>{@link DurableAgentException}이면 재시도 가능 여부를 그대로 가져오고,
     * 그 외의 예외는 재시도 불가로 기록합니다.</p>
     *
     * @param throwable 원인 예외
     * @return FailureDetails 인스턴스
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static FailureDetails from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        boolean retryable = throwable instanceof DurableAgentException
            && ((DurableAgentException) throwable).isRetryable();
        String message = throwable.getMessage() != null ? throwable.getMessage() : "";
        return new FailureDetails(throwable.getClass().getSimpleName(), message, retryable);
    }
}
