package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.core.spi.BatchTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ScheduledThreadPoolExecutor} 기반 BatchTimer.
 *
 * <p>스레드 이름은 {@code batchqueue-timer-N}, 데몬 스레드입니다.
 * 취소된 작업은 즉시 큐에서 제거됩니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class ScheduledBatchTimer implements BatchTimer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBatchTimer.class);

    private final ScheduledThreadPoolExecutor scheduler;

    /**
     * 생성자.
     *
     * @param threads 스레드 수 (2 이상)
     * @throws IllegalArgumentException threads가 2 미만인 경우
     */
    public ScheduledBatchTimer(int threads) {
        if (threads < 2) {
            throw new IllegalArgumentException("threads must be >= 2 (current: " + threads + ")");
        }
        this.scheduler = new ScheduledThreadPoolExecutor(threads, new TimerThreadFactory());
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0 (current: " + delayMs + ")");
        }
        ScheduledFuture<?> future = scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    /**
     * 타이머 종료.
     *
     * <p>대기 중인 작업은 실행하지 않고, 실행 중인 배치는 완료까지 최대 10초 대기합니다.</p>
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Timer threads did not terminate within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for timer threads", e);
        }
    }

    /**
     * 종료 여부.
     *
     * @return shutdown 호출 후 true
     */
    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    private static final class TimerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "batchqueue-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
