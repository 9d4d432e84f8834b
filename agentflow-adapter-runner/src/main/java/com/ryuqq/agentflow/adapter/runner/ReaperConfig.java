package com.ryuqq.agentflow.adapter.runner;

/**
 * InstanceReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>stuckThresholdMs: 호출 유실 판단 임계값 (기본 600000ms = 10분)</li>
 *   <li>batchSize: 상태별 한 번에 스캔할 인스턴스 수 (기본 50)</li>
 *   <li>defaultStrategy: 기본 리컨실 전략 (기본 FAIL)</li>
 * </ul>
 *
 * <p><strong>임계값 설정 가이드:</strong> 가장 느린 에이전트 호출보다 충분히 길게 잡아야
 * 정상 진행 중인 호출을 유실로 판단하지 않습니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param stuckThresholdMs 유실 판단 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param defaultStrategy 기본 리컨실 전략 (null이 아니어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    long stuckThresholdMs,
    int batchSize,
    ReconcileStrategy defaultStrategy
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms, stuckThresholdMs=600000ms, batchSize=50,
     * defaultStrategy=FAIL</p>
     */
    public ReaperConfig() {
        this(60_000, 600_000, 50, ReconcileStrategy.FAIL);
    }

    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException("scanIntervalMs must be positive (current: " + scanIntervalMs + ")");
        }
        if (stuckThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "stuckThresholdMs must be positive (current: " + stuckThresholdMs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (defaultStrategy == null) {
            throw new IllegalArgumentException("defaultStrategy cannot be null");
        }
    }

    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, stuckThresholdMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withStuckThresholdMs(long stuckThresholdMs) {
        return new ReaperConfig(scanIntervalMs, stuckThresholdMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, stuckThresholdMs, batchSize, defaultStrategy);
    }

    public ReaperConfig withDefaultStrategy(ReconcileStrategy defaultStrategy) {
        return new ReaperConfig(scanIntervalMs, stuckThresholdMs, batchSize, defaultStrategy);
    }
}
