package com.ryuqq.batchqueue.testkit.time;

import com.ryuqq.batchqueue.core.spi.BatchTimer;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;

/**
 * Virtual-time {@link BatchTimer} for deterministic tests.
 *
 * <p>Nothing runs until {@link #advance(long)} is called. Due tasks then run on the calling
 * thread in due-time order (ties in scheduling order). Tasks scheduled while advancing run in
 * the same call when they fall due before the target time.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualBatchTimer timer = new ManualBatchTimer();
 * RequestQueue queue = new BatchingRequestQueue(executor, timer, config);
 *
 * CompletableFuture&lt;OperationResult&gt; future = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
 * timer.advance(999);   // not yet
 * timer.advance(1);     // READ batch fires, future completes on this thread
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class ManualBatchTimer implements BatchTimer {

    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>(
        Comparator.comparingLong(ScheduledTask::dueAtMillis).thenComparingLong(ScheduledTask::order)
    );
    private long nowMillis;
    private long nextOrder;

    @Override
    public synchronized TimerHandle schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0 (current: " + delayMs + ")");
        }
        ScheduledTask scheduled = new ScheduledTask(task, nowMillis + delayMs, nextOrder++);
        tasks.add(scheduled);
        return () -> cancel(scheduled);
    }

    @Override
    public synchronized long nanoTime() {
        return TimeUnit.MILLISECONDS.toNanos(nowMillis);
    }

    /**
     * Moves virtual time forward, running every task that falls due.
     *
     * @param millis amount of time to advance (0 runs tasks due now)
     * @throws IllegalArgumentException if millis is negative
     */
    public void advance(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be >= 0 (current: " + millis + ")");
        }
        long target;
        synchronized (this) {
            target = nowMillis + millis;
        }
        while (true) {
            ScheduledTask next;
            synchronized (this) {
                next = tasks.peek();
                if (next == null || next.dueAtMillis() > target) {
                    nowMillis = target;
                    return;
                }
                tasks.poll();
                nowMillis = next.dueAtMillis();
            }
            next.task().run();
        }
    }

    /**
     * Current virtual time in milliseconds since the timer was created.
     */
    public synchronized long nowMillis() {
        return nowMillis;
    }

    /**
     * Number of scheduled tasks that have neither run nor been cancelled.
     */
    public synchronized int pendingTaskCount() {
        return tasks.size();
    }

    private synchronized boolean cancel(ScheduledTask scheduled) {
        return tasks.remove(scheduled);
    }

    private record ScheduledTask(Runnable task, long dueAtMillis, long order) {
    }
}
