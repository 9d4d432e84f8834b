package com.ryuqq.agentflow.adapter.runner;

/**
 * EventDeliveryWorker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 큐 폴링 간격 (기본 50ms)</li>
 *   <li>batchSize: 한 번에 dequeue할 메시지 수 (기본 10)</li>
 *   <li>maxRetries: 일시 실패 시 최대 전달 시도 횟수 (기본 5)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: pollingIntervalMs 감소 (50 → 10)</li>
 *   <li>높은 처리량: batchSize 증가 (10 → 50)</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 * @param pollingIntervalMs 큐 폴링 간격 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param maxRetries 최대 전달 시도 횟수 (1 이상이어야 함)
 */
public record EventWorkerConfig(
    long pollingIntervalMs,
    int batchSize,
    int maxRetries
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollingIntervalMs=50ms, batchSize=10, maxRetries=5</p>
     */
    public EventWorkerConfig() {
        this(50, 10, 5);
    }

    public EventWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
    }

    public EventWorkerConfig withPollingIntervalMs(long pollingIntervalMs) {
        return new EventWorkerConfig(pollingIntervalMs, batchSize, maxRetries);
    }

    public EventWorkerConfig withBatchSize(int batchSize) {
        return new EventWorkerConfig(pollingIntervalMs, batchSize, maxRetries);
    }

    public EventWorkerConfig withMaxRetries(int maxRetries) {
        return new EventWorkerConfig(pollingIntervalMs, batchSize, maxRetries);
    }
}
