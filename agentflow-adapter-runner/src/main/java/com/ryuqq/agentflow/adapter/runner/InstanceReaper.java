package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.core.error.TransientInfraException;
import com.ryuqq.agentflow.core.history.ActionKind;
import com.ryuqq.agentflow.core.history.History;
import com.ryuqq.agentflow.core.history.HistoryEvent;
import com.ryuqq.agentflow.core.model.InstanceId;
import com.ryuqq.agentflow.core.outcome.FailureDetails;
import com.ryuqq.agentflow.core.spi.HistoryStore;
import com.ryuqq.agentflow.core.statemachine.InstanceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * InstanceReaper 컴포넌트.
 *
 * <p>종료되지 않은 인스턴스를 스캔하여 재시작 등으로 끊긴 진행을 복구합니다.</p>
 *
 * <p><strong>리컨실 시나리오:</strong></p>
 * <pre>
 * 1. 인스턴스가 에이전트 호출을 SCHEDULED로 기록하고 디스패치
 * 2. 프로세스 재시작 → 호출 결과 유실, 타이머 소멸
 * 3. Reaper가 주기적으로 RUNNING / PENDING 인스턴스 스캔
 * 4. 인스턴스별:
 *    - TIMER 레코드 → 타이머 재등록
 *    - SUB_ORCHESTRATION 레코드 → 하위 인스턴스 재활성화
 *    - stuckThreshold를 넘긴 호출 레코드 (이 프로세스에서 실행 중이 아닌 것):
 *        RETRY: 재디스패치 / FAIL: FAILED 레코드 기록
 *    - 인스턴스 재활성화 (재실행은 멱등)
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class InstanceReaper {

    private static final Logger log = LoggerFactory.getLogger(InstanceReaper.class);

    private final HistoryStore historyStore;
    private final DurableOrchestrationRunner engine;
    private final ReaperConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param historyStore History 저장소
     * @param engine Orchestration Engine
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InstanceReaper(HistoryStore historyStore, DurableOrchestrationRunner engine, ReaperConfig config) {
        if (historyStore == null) {
            throw new IllegalArgumentException("historyStore cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.historyStore = historyStore;
        this.engine = engine;
        this.config = config;
    }

    /**
     * 비종료 인스턴스 스캔 및 리컨실.
     *
     * @return 리컨실된 인스턴스 수
     */
    public int scan() {
        log.info("Reaper scan started");

        List<InstanceId> candidates = new ArrayList<>();
        candidates.addAll(historyStore.scanByStatus(InstanceStatus.RUNNING, config.batchSize()));
        candidates.addAll(historyStore.scanByStatus(InstanceStatus.PENDING, config.batchSize()));

        int reconciled = 0;
        for (InstanceId instanceId : candidates) {
            if (tryReconcile(instanceId)) {
                reconciled++;
            }
        }

        log.info("Reaper scan completed: {} reconciled out of {} open", reconciled, candidates.size());
        return reconciled;
    }

    /**
     * scanIntervalMs 주기로 scan() 실행 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("InstanceReaper already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::safeScan, config.scanIntervalMs(), config.scanIntervalMs(),
            TimeUnit.MILLISECONDS);
    }

    public synchronized void shutdown() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
    }

    private void safeScan() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Reaper scan failed", e);
        }
    }

    private boolean tryReconcile(InstanceId instanceId) {
        try {
            long now = System.currentTimeMillis();
            for (HistoryEvent scheduled : History.unresolved(historyStore.getHistory(instanceId))) {
                if (engine.isInFlight(instanceId, scheduled.taskId())) {
                    continue;
                }
                if (scheduled.kind() == ActionKind.TIMER || scheduled.kind() == ActionKind.SUB_ORCHESTRATION) {
                    engine.redispatch(instanceId, scheduled);
                    log.info("Reaper re-armed {}#{} for {}", scheduled.name(), scheduled.taskId(),
                        instanceId.getValue());
                } else if (now - scheduled.timestamp() >= config.stuckThresholdMs()) {
                    reconcileCall(instanceId, scheduled);
                }
            }
            engine.resume(instanceId);
            return true;
        } catch (Exception e) {
            log.error("Failed to reconcile {} in Reaper scan", instanceId.getValue(), e);
            return false;
        }
    }

    private void reconcileCall(InstanceId instanceId, HistoryEvent scheduled) {
        ReconcileStrategy strategy = config.defaultStrategy();
        switch (strategy) {
            case RETRY -> engine.redispatch(instanceId, scheduled);
            case FAIL -> engine.failAction(instanceId, scheduled, FailureDetails.from(new TransientInfraException(
                "Call " + scheduled.name() + "#" + scheduled.taskId() + " lost in flight")));
        }
        log.info("Reaper reconciled {}#{} for {} with strategy: {}", scheduled.name(), scheduled.taskId(),
            instanceId.getValue(), strategy);
    }
}
