package com.ryuqq.batchqueue.testkit.contract;

import com.ryuqq.batchqueue.core.model.Batch;
import com.ryuqq.batchqueue.core.spi.BatchExecutor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link BatchExecutor} decorator that records every batch before delegating.
 *
 * <p>Lets contract tests count handler invocations and inspect batch composition.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class RecordingBatchExecutor implements BatchExecutor {

    private final BatchExecutor delegate;
    private final List<Batch> batches = new CopyOnWriteArrayList<>();

    /**
     * @param delegate executor that actually resolves the entries
     * @throws IllegalArgumentException if delegate is null
     */
    public RecordingBatchExecutor(BatchExecutor delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void handleReadBatch(Batch batch) {
        record(batch);
        delegate.handleReadBatch(batch);
    }

    @Override
    public void handleWriteBatch(Batch batch) {
        record(batch);
        delegate.handleWriteBatch(batch);
    }

    private void record(Batch batch) {
        batches.add(batch);
    }

    /**
     * All batches received so far, in execution order.
     */
    public List<Batch> batches() {
        return List.copyOf(batches);
    }

    /**
     * Fire times of all received batches, in execution order.
     */
    public List<Long> firedAtNanos() {
        return batches.stream().map(Batch::firedAtNanos).toList();
    }

    /**
     * Total number of entries executed across all batches.
     */
    public int executedEntryCount() {
        return batches.stream().mapToInt(Batch::size).sum();
    }
}
