package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.application.queue.QueueStats;
import com.ryuqq.batchqueue.application.queue.RequestQueue;
import com.ryuqq.batchqueue.core.error.InternalOperationException;
import com.ryuqq.batchqueue.core.error.ValidationException;
import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.Batch;
import com.ryuqq.batchqueue.core.model.DedupKeys;
import com.ryuqq.batchqueue.core.model.OperationClass;
import com.ryuqq.batchqueue.core.model.OperationPayload;
import com.ryuqq.batchqueue.core.model.PageLimits;
import com.ryuqq.batchqueue.core.model.PendingEntry;
import com.ryuqq.batchqueue.core.model.Waiter;
import com.ryuqq.batchqueue.core.result.DuplicateWriteSuppressed;
import com.ryuqq.batchqueue.core.result.OperationResult;
import com.ryuqq.batchqueue.core.spi.BatchExecutor;
import com.ryuqq.batchqueue.core.spi.BatchTimer;
import com.ryuqq.batchqueue.core.spi.BatchTimer.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 요청 병합 스케줄러.
 *
 * <p>제출된 요청을 dedup key 단위로 모아 두었다가 클래스별 배치 윈도우가 끝나면
 * {@link BatchExecutor}에 한 번에 넘깁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(action, payload)
 *   ↓
 * payload = pageLimits.normalize(action, payload)   (조회 기본값, limit clamp)
 * key = DedupKeys.derive(action, payload)
 *   ↓ (registry lock)
 *   - 대기 엔트리 있음 + READ  → Waiter 합류
 *   - 대기 엔트리 있음 + WRITE → DuplicateWriteSuppressed 즉시 완료
 *   - 없음                    → lane 타이머 arm 후 엔트리 생성 (arm 실패 시 엔트리 없이 실패)
 *
 * fire(lane)
 *   1. (lock) 해당 클래스 엔트리 전부 drain → Batch, lane running 표시
 *   2. executor.handleReadBatch / handleWriteBatch (lock 밖)
 *   3. 미완료 엔트리 → InternalOperationException
 *   4. (lock) running 해제, 대기 엔트리가 남았으면 다시 arm
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>join-or-create 판단과 drain은 하나의 {@link ReentrantLock} 임계 구역</li>
 *   <li>lane 타이머가 대기 중이거나 같은 클래스 배치가 실행 중이면 arm하지 않음 (클래스 내 배치 순차 실행)</li>
 *   <li>READ와 WRITE lane은 서로 독립</li>
 * </ul>
 *
 * <p><strong>WRITE 중복:</strong> 대기 중인 WRITE와 같은 키의 두 번째 WRITE는 실행되지 않고
 * {@link DuplicateWriteSuppressed}로 완료됩니다. 호출자는 {@link OperationResult#isSuppressed()}로
 * 구분해야 합니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class BatchingRequestQueue implements RequestQueue, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchingRequestQueue.class);

    private final BatchExecutor executor;
    private final BatchTimer timer;
    private final PageLimits pageLimits;
    private final ReentrantLock lock;
    private final Map<String, PendingEntry> registry;
    private final Map<OperationClass, Lane> lanes;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param executor 배치 실행자
     * @param timer 배치 타이머
     * @param config 설정 (배치 윈도우, 페이지 크기 정책)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchingRequestQueue(BatchExecutor executor, BatchTimer timer, BatchQueueConfig config) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executor = executor;
        this.timer = timer;
        this.pageLimits = config.pageLimits();
        this.lock = new ReentrantLock();
        this.registry = new LinkedHashMap<>();
        this.lanes = new EnumMap<>(OperationClass.class);
        this.lanes.put(OperationClass.READ, new Lane(OperationClass.READ, config.readDelayMs()));
        this.lanes.put(OperationClass.WRITE, new Lane(OperationClass.WRITE, config.writeDelayMs()));
    }

    @Override
    public CompletableFuture<OperationResult> submit(Action action, OperationPayload requested) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (requested != null && !action.accepts(requested)) {
            return CompletableFuture.failedFuture(new ValidationException(
                "Invalid input",
                action + " requires " + action.payloadType().getSimpleName()
                    + " but got " + requested.getClass().getSimpleName()
            ));
        }

        OperationPayload payload = pageLimits.normalize(action, requested);
        String key;
        try {
            key = DedupKeys.derive(action, payload);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new ValidationException("Invalid input", e.getMessage()));
        }

        Waiter waiter = Waiter.joinedAt(timer.nanoTime());
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new InternalOperationException("queue shut down"));
            }

            PendingEntry existing = registry.get(key);
            if (existing != null) {
                if (action.operationClass().isRead()) {
                    existing.join(waiter);
                    log.debug("{} joined pending entry ({} waiters)", key, existing.waiterCount());
                    return waiter.completion();
                }
                log.info("Duplicate write suppressed: {}", key);
                return CompletableFuture.completedFuture(DuplicateWriteSuppressed.of(key));
            }

            try {
                arm(lanes.get(action.operationClass()));
            } catch (RuntimeException e) {
                log.error("Failed to schedule {} batch for {}", action.operationClass(), key, e);
                return CompletableFuture.failedFuture(new InternalOperationException("Failed to schedule batch", e));
            }
            registry.put(key, new PendingEntry(key, action, payload, waiter));
            return waiter.completion();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStats stats() {
        lock.lock();
        try {
            int reads = countPending(OperationClass.READ);
            int writes = registry.size() - reads;
            return new QueueStats(
                registry.size(),
                reads,
                writes,
                lanes.get(OperationClass.READ).runningBatchSize,
                lanes.get(OperationClass.WRITE).runningBatchSize
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * 큐 종료.
     *
     * <p>대기 중인 타이머를 취소하고 아직 실행되지 않은 엔트리를 {@code queue shut down}으로 실패시킵니다.
     * 이미 실행 중인 배치는 그대로 완료됩니다. 이후 submit은 즉시 실패합니다.</p>
     */
    @Override
    public void close() {
        List<PendingEntry> abandoned;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (Lane lane : lanes.values()) {
                if (lane.armed != null) {
                    lane.armed.cancel();
                    lane.armed = null;
                }
            }
            abandoned = new ArrayList<>(registry.values());
            registry.clear();
        } finally {
            lock.unlock();
        }

        for (PendingEntry entry : abandoned) {
            entry.fail(new InternalOperationException("queue shut down"));
        }
        log.info("Request queue closed ({} pending entries rejected)", abandoned.size());
    }

    /**
     * lane 타이머 arm. lock 보유 상태에서 호출.
     *
     * <p>타이머가 예약을 거부하면 lane은 arm되지 않은 상태로 남고 예외가 그대로 전파됩니다.</p>
     */
    private void arm(Lane lane) {
        if (closed || lane.armed != null || lane.running) {
            return;
        }
        lane.armed = timer.schedule(() -> fire(lane), lane.delayMs);
    }

    /**
     * 배치 발화.
     *
     * @param lane 발화한 lane
     */
    private void fire(Lane lane) {
        Batch batch = drain(lane);
        if (batch == null) {
            return;
        }

        log.debug("{} batch #{} fired with {} entries", lane.operationClass, batch.sequence(), batch.size());
        RuntimeException failure = null;
        try {
            if (lane.operationClass.isRead()) {
                executor.handleReadBatch(batch);
            } else {
                executor.handleWriteBatch(batch);
            }
        } catch (RuntimeException e) {
            failure = e;
            log.error("{} batch #{} executor failed", lane.operationClass, batch.sequence(), e);
        } finally {
            failUnresolved(batch, failure);
            finish(lane);
        }
        log.debug("{} batch #{} finished", lane.operationClass, batch.sequence());
    }

    private Batch drain(Lane lane) {
        lock.lock();
        try {
            lane.armed = null;
            if (closed) {
                return null;
            }

            List<PendingEntry> drained = removePending(lane.operationClass);
            if (drained.isEmpty()) {
                return null;
            }

            lane.running = true;
            lane.runningBatchSize = drained.size();
            lane.sequence++;
            return new Batch(lane.operationClass, drained, timer.nanoTime(), lane.sequence);
        } finally {
            lock.unlock();
        }
    }

    private void failUnresolved(Batch batch, RuntimeException cause) {
        for (PendingEntry entry : batch.entries()) {
            if (!entry.isDone()) {
                entry.fail(new InternalOperationException("Request was not processed: " + entry.key(), cause));
                log.warn("{} left unresolved by batch #{}", entry.key(), batch.sequence());
            }
        }
    }

    private void finish(Lane lane) {
        List<PendingEntry> stranded = List.of();
        RuntimeException armFailure = null;
        lock.lock();
        try {
            lane.running = false;
            lane.runningBatchSize = 0;
            if (countPending(lane.operationClass) > 0) {
                try {
                    arm(lane);
                } catch (RuntimeException e) {
                    armFailure = e;
                    stranded = removePending(lane.operationClass);
                }
            }
        } finally {
            lock.unlock();
        }

        if (armFailure != null) {
            log.error("Failed to re-arm {} lane ({} pending entries failed)", lane.operationClass, stranded.size(), armFailure);
            for (PendingEntry entry : stranded) {
                entry.fail(new InternalOperationException("Failed to schedule batch", armFailure));
            }
        }
    }

    private List<PendingEntry> removePending(OperationClass operationClass) {
        List<PendingEntry> removed = new ArrayList<>();
        Iterator<PendingEntry> iterator = registry.values().iterator();
        while (iterator.hasNext()) {
            PendingEntry entry = iterator.next();
            if (entry.operationClass() == operationClass) {
                removed.add(entry);
                iterator.remove();
            }
        }
        return removed;
    }

    private int countPending(OperationClass operationClass) {
        int count = 0;
        for (PendingEntry entry : registry.values()) {
            if (entry.operationClass() == operationClass) {
                count++;
            }
        }
        return count;
    }

    /**
     * 클래스별 타이머/실행 상태. registry lock으로 보호됩니다.
     */
    private static final class Lane {

        private final OperationClass operationClass;
        private final long delayMs;
        private TimerHandle armed;
        private boolean running;
        private int runningBatchSize;
        private long sequence;

        private Lane(OperationClass operationClass, long delayMs) {
            this.operationClass = operationClass;
            this.delayMs = delayMs;
        }
    }
}
