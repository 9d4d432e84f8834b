package com.ryuqq.agentflow.adapter.runner;

/**
 * SessionEntityDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 에이전트 실행 스레드 수 (기본 8)</li>
 *   <li>maxQueuedPerSession: 세션별 대기 요청 상한 (기본 64)</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 * @param concurrency 실행 스레드 수 (1 이상)
 * @param maxQueuedPerSession 세션별 대기 요청 상한 (1 이상)
 */
public record SessionDispatcherConfig(
    int concurrency,
    int maxQueuedPerSession
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, maxQueuedPerSession=64</p>
     */
    public SessionDispatcherConfig() {
        this(8, 64);
    }

    public SessionDispatcherConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (maxQueuedPerSession <= 0) {
            throw new IllegalArgumentException(
                "maxQueuedPerSession must be positive (current: " + maxQueuedPerSession + ")");
        }
    }

    public SessionDispatcherConfig withConcurrency(int concurrency) {
        return new SessionDispatcherConfig(concurrency, maxQueuedPerSession);
    }

    public SessionDispatcherConfig withMaxQueuedPerSession(int maxQueuedPerSession) {
        return new SessionDispatcherConfig(concurrency, maxQueuedPerSession);
    }
}
