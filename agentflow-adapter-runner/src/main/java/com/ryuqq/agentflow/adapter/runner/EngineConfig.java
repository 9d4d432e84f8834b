package com.ryuqq.agentflow.adapter.runner;

/**
 * DurableOrchestrationRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 인스턴스 활성화 스레드 수 (기본 8)</li>
 *   <li>activityConcurrency: Activity 실행 스레드 수 (기본 4)</li>
 *   <li>maxHistoryEvents: 인스턴스별 History 레코드 상한 (기본 10000)</li>
 *   <li>maxQueuedEventsPerInstance: 인스턴스별 대기 이벤트 상한 (기본 256)</li>
 * </ul>
 *
 * <p>History 상한을 넘기는 인스턴스는 {@code HistoryLimitExceededException}으로 실패합니다.
 * 대기 이벤트 상한을 넘긴 이벤트는 Event Bus에서 backoff 후 재전달됩니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 * @param concurrency 활성화 스레드 수 (1 이상)
 * @param activityConcurrency Activity 스레드 수 (1 이상)
 * @param maxHistoryEvents History 상한 (1 이상)
 * @param maxQueuedEventsPerInstance 대기 이벤트 상한 (1 이상)
 */
public record EngineConfig(
    int concurrency,
    int activityConcurrency,
    int maxHistoryEvents,
    int maxQueuedEventsPerInstance
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, activityConcurrency=4, maxHistoryEvents=10000,
     * maxQueuedEventsPerInstance=256</p>
     */
    public EngineConfig() {
        this(8, 4, 10_000, 256);
    }

    public EngineConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (activityConcurrency <= 0) {
            throw new IllegalArgumentException(
                "activityConcurrency must be positive (current: " + activityConcurrency + ")");
        }
        if (maxHistoryEvents <= 0) {
            throw new IllegalArgumentException(
                "maxHistoryEvents must be positive (current: " + maxHistoryEvents + ")");
        }
        if (maxQueuedEventsPerInstance <= 0) {
            throw new IllegalArgumentException(
                "maxQueuedEventsPerInstance must be positive (current: " + maxQueuedEventsPerInstance + ")");
        }
    }

    public EngineConfig withConcurrency(int concurrency) {
        return new EngineConfig(concurrency, activityConcurrency, maxHistoryEvents, maxQueuedEventsPerInstance);
    }

    public EngineConfig withActivityConcurrency(int activityConcurrency) {
        return new EngineConfig(concurrency, activityConcurrency, maxHistoryEvents, maxQueuedEventsPerInstance);
    }

    public EngineConfig withMaxHistoryEvents(int maxHistoryEvents) {
        return new EngineConfig(concurrency, activityConcurrency, maxHistoryEvents, maxQueuedEventsPerInstance);
    }

    public EngineConfig withMaxQueuedEventsPerInstance(int maxQueuedEventsPerInstance) {
        return new EngineConfig(concurrency, activityConcurrency, maxHistoryEvents, maxQueuedEventsPerInstance);
    }
}
