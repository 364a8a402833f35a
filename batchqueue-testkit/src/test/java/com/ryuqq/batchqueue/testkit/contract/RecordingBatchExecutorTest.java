package com.ryuqq.batchqueue.testkit.contract;

import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.Batch;
import com.ryuqq.batchqueue.core.model.OperationClass;
import com.ryuqq.batchqueue.core.model.PageQuery;
import com.ryuqq.batchqueue.core.model.PendingEntry;
import com.ryuqq.batchqueue.core.model.Waiter;
import com.ryuqq.batchqueue.core.spi.BatchExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

/**
 * RecordingBatchExecutor 테스트.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RecordingBatchExecutorTest {

    @Mock
    private BatchExecutor delegate;

    @Test
    void 배치를_기록한_뒤_위임함() {
        // given
        RecordingBatchExecutor recording = new RecordingBatchExecutor(delegate);
        PendingEntry entry = new PendingEntry("FETCH_PAGE:0:10:", Action.FETCH_PAGE, PageQuery.of(0, 10), Waiter.joinedAt(0));
        Batch read = new Batch(OperationClass.READ, List.of(entry), 5L, 1L);
        Batch write = new Batch(OperationClass.WRITE, List.of(), 9L, 1L);

        // when
        recording.handleReadBatch(read);
        recording.handleWriteBatch(write);

        // then
        verify(delegate).handleReadBatch(read);
        verify(delegate).handleWriteBatch(write);
        assertThat(recording.batches()).containsExactly(read, write);
        assertThat(recording.firedAtNanos()).containsExactly(5L, 9L);
        assertThat(recording.executedEntryCount()).isEqualTo(1);
    }
}
