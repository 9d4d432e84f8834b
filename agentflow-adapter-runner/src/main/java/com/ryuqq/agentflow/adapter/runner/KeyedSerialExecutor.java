package com.ryuqq.agentflow.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 키별 직렬 실행기.
 *
 * <p>같은 키로 제출된 작업은 제출 순서대로 한 번에 하나씩 실행되고,
 * 서로 다른 키의 작업은 공유 스레드 풀에서 동시에 실행됩니다.
 * 키마다 스레드를 두지 않으며, 대기 작업이 없는 키의 레인은 즉시 제거됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * submit(key, task)
 *   ↓ lanes.compute(key): 레인 큐에 추가
 *   ↓ 레인이 유휴 상태였으면 풀에 drain(key) 제출
 * drain(key)
 *   ↓ 큐에서 하나 꺼내 실행 → 반복
 *   ↓ 큐가 비면 레인 제거
 * </pre>
 *
 * @param <K> 키 타입 (equals/hashCode 구현 필요)
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class KeyedSerialExecutor<K> {

    private static final Logger log = LoggerFactory.getLogger(KeyedSerialExecutor.class);

    private final ExecutorService pool;
    private final ConcurrentHashMap<K, Lane> lanes = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param concurrency 공유 풀 스레드 수
     * @throws IllegalArgumentException concurrency가 양수가 아닌 경우
     */
    public KeyedSerialExecutor(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        this.pool = Executors.newFixedThreadPool(concurrency);
    }

    /**
     * 대기 상한 없이 작업 제출.
     *
     * @param key 직렬화 키
     * @param task 실행할 작업
     * @return 작업 결과 Future
     */
    public <T> CompletableFuture<T> submit(K key, Callable<T> task) {
        return enqueue(key, task, Integer.MAX_VALUE);
    }

    /**
     * 대기 상한을 지키며 작업 제출.
     *
     * @param key 직렬화 키
     * @param task 실행할 작업
     * @param maxQueued 키별 대기 작업 상한 (실행 중인 작업 제외)
     * @return 작업 결과 Future
     * @throws RejectedExecutionException 대기 작업이 상한에 도달한 경우
     */
    public <T> CompletableFuture<T> trySubmit(K key, Callable<T> task, int maxQueued) {
        if (maxQueued <= 0) {
            throw new IllegalArgumentException("maxQueued must be positive (current: " + maxQueued + ")");
        }
        return enqueue(key, task, maxQueued);
    }

    /**
     * 키의 대기 작업 수 (실행 중인 작업 제외).
     */
    public int queuedCount(K key) {
        Lane lane = lanes.get(key);
        if (lane == null) {
            return 0;
        }
        synchronized (lane) {
            return lane.queue.size();
        }
    }

    public int activeLaneCount() {
        return lanes.size();
    }

    /**
     * 풀 종료 (진행 중인 작업 완료 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        pool.shutdown();
        if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
            List<Runnable> dropped = pool.shutdownNow();
            log.warn("Serial executor forced shutdown, {} lanes dropped", dropped.size());
        }
    }

    private <T> CompletableFuture<T> enqueue(K key, Callable<T> task, int maxQueued) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        Job job = new Job(future, () -> {
            try {
                future.complete(task.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });

        boolean[] startDrain = new boolean[1];
        lanes.compute(key, (k, lane) -> {
            Lane current = lane != null ? lane : new Lane();
            synchronized (current) {
                if (current.queue.size() >= maxQueued) {
                    throw new RejectedExecutionException(
                        "Lane " + k + " has " + current.queue.size() + " queued tasks (max: " + maxQueued + ")");
                }
                current.queue.add(job);
                if (!current.running) {
                    current.running = true;
                    startDrain[0] = true;
                }
            }
            return current;
        });

        if (startDrain[0]) {
            try {
                pool.execute(() -> drain(key));
            } catch (RejectedExecutionException e) {
                abandon(key, e);
                throw e;
            }
        }
        return future;
    }

    private void drain(K key) {
        while (true) {
            Job[] next = new Job[1];
            lanes.computeIfPresent(key, (k, lane) -> {
                synchronized (lane) {
                    next[0] = lane.queue.poll();
                    if (next[0] == null) {
                        lane.running = false;
                        return null;
                    }
                    return lane;
                }
            });
            if (next[0] == null) {
                return;
            }
            next[0].body.run();
        }
    }

    private void abandon(K key, RejectedExecutionException cause) {
        Lane lane = lanes.remove(key);
        if (lane == null) {
            return;
        }
        log.warn("Pool rejected lane {}, failing queued tasks", key);
        synchronized (lane) {
            for (Job job : lane.queue) {
                job.future.completeExceptionally(cause);
            }
            lane.queue.clear();
            lane.running = false;
        }
    }

    private static final class Lane {

        private final ArrayDeque<Job> queue = new ArrayDeque<>();
        private boolean running;
    }

    private static final class Job {

        private final CompletableFuture<?> future;
        private final Runnable body;

        Job(CompletableFuture<?> future, Runnable body) {
            this.future = future;
            this.body = body;
        }
    }
}
