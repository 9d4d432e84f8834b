package com.ryuqq.agentflow.core.orchestration;

/**
 * Orchestration 호출 지점의 결과 핸들.
 *
 * <p>{@link #await()}는 History에 기록된 결과를 반환합니다. 결과가 아직 없으면
 * 함수 실행이 중단되고, 결과가 기록된 뒤 함수가 처음부터 다시 실행됩니다.</p>
 *
 * @param <V> 결과 타입
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface Task<V> {

    /**
     * 결과(성공 또는 실패)가 기록되었는지 확인.
     */
    boolean isDone();

    /**
     * 실패로 기록되었는지 확인.
     */
    boolean isFailed();

    /**
     * 결과 대기.
     *
     * @return 기록된 결과
     * @throws com.ryuqq.agentflow.core.error.TaskFailedException 단일 호출이 실패로 기록된 경우
     * @throws com.ryuqq.agentflow.core.error.AggregateChildFailureException allOf 참가자가 실패한 경우
     */
    V await();
}
