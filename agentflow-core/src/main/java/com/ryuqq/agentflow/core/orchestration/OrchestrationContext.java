package com.ryuqq.agentflow.core.orchestration;

import com.ryuqq.agentflow.core.model.InstanceId;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Orchestration 함수가 외부 세계와 상호작용하는 유일한 통로.
 *
 * <p>각 호출 메서드는 호출 지점(call site)이며, 함수 내에서 호출된 순서대로
 * 결정적인 taskId를 받습니다. 재실행 시 같은 taskId의 History 레코드로 결과가 채워집니다.</p>
 *
 * <p><strong>결정성 규칙:</strong></p>
 * <ul>
 *   <li>현재 시각은 {@link #currentTime()}, 식별자는 {@link #newUuid()}로만 얻습니다</li>
 *   <li>I/O는 에이전트/Activity/하위 Orchestration 호출로만 수행합니다</li>
 *   <li>같은 History에 대해 항상 같은 순서로 호출 지점을 만들어야 합니다</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface OrchestrationContext {

    InstanceId getInstanceId();

    /**
     * Orchestration 이름.
     */
    String getName();

    /**
     * 입력 조회.
     *
     * @param type 입력 타입
     * @param <T> 입력 타입
     * @return 입력 (없으면 null)
     */
    <T> T getInput(Class<T> type);

    /**
     * 결정적 현재 시각.
     *
     * <p>인스턴스 생성 시각에서 시작하여, 기다린 결과가 기록된 시각으로 진행합니다.</p>
     */
    Instant currentTime();

    /**
     * 결정적 UUID (재실행 시 같은 값).
     */
    UUID newUuid();

    /**
     * 이미 기록된 호출 지점을 재실행 중인지 확인 (로그 중복 방지용).
     */
    boolean isReplaying();

    /**
     * 사용자 정의 상태 설정 (상태 조회 결과에 노출).
     *
     * @param customStatus JSON으로 변환 가능한 값 (null이면 해제)
     */
    void setCustomStatus(Object customStatus);

    /**
     * 에이전트 세션 호출.
     *
     * @param agentName 에이전트 이름
     * @param sessionId 세션 ID (빈 값이면 {@link #newUuid()}로 생성)
     * @param input 입력 (문자열이 아니면 JSON으로 변환)
     * @return 응답 텍스트 Task
     */
    Task<String> callAgent(String agentName, String sessionId, Object input);

    /**
     * Activity 호출.
     */
    <T> Task<T> callActivity(String name, Object input, Class<T> resultType);

    /**
     * 하위 Orchestration 호출.
     *
     * <p>하위 인스턴스 ID는 부모 ID와 taskId로 결정적으로 만들어집니다.</p>
     */
    <T> Task<T> callSubOrchestration(String name, Object input, Class<T> resultType);

    /**
     * 지속 타이머 생성.
     *
     * @param delay 대기 시간 ({@link #currentTime()} 기준)
     * @return 만료 시 완료되는 Task
     */
    Task<Void> createTimer(Duration delay);

    /**
     * 외부 이벤트 대기.
     *
     * <p>같은 이름의 n번째 대기는 n번째로 전달된 이벤트를 받습니다.
     * 대기 지점에 도달하기 전에 전달된 이벤트는 버퍼링됩니다.</p>
     *
     * @param eventName 이벤트 이름
     * @param payloadType 이벤트 데이터 타입
     * @return 이벤트 데이터 Task
     */
    <T> Task<T> waitForEvent(String eventName, Class<T> payloadType);

    /**
     * 모든 Task 대기 (fan-in).
     *
     * <p>모든 참가자가 완료되면 결과 목록으로 완료됩니다. 하나라도 실패하면 남은 참가자를
     * 기다리지 않고, 그 시점까지 실패한 참가자를 담은 AggregateChildFailureException으로 실패합니다.</p>
     */
    <T> Task<List<T>> allOf(List<Task<T>> tasks);

    /**
     * 가장 먼저 완료된 Task 대기.
     *
     * <p>완료 레코드의 순번이 가장 작은 참가자가 결과가 됩니다. 나머지는 취소되지 않습니다.</p>
     */
    Task<Task<?>> anyOf(List<? extends Task<?>> tasks);
}
