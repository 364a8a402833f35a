package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.application.queue.QueueStats;
import com.ryuqq.batchqueue.core.error.InternalOperationException;
import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.Batch;
import com.ryuqq.batchqueue.core.model.IdList;
import com.ryuqq.batchqueue.core.model.PageQuery;
import com.ryuqq.batchqueue.core.model.PendingEntry;
import com.ryuqq.batchqueue.core.result.OperationResult;
import com.ryuqq.batchqueue.core.result.PageInfo;
import com.ryuqq.batchqueue.core.result.RecordPage;
import com.ryuqq.batchqueue.core.spi.BatchExecutor;
import com.ryuqq.batchqueue.core.spi.BatchTimer;
import com.ryuqq.batchqueue.testkit.time.ManualBatchTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * BatchingRequestQueue 유닛 테스트.
 *
 * <p>BatchExecutor를 Mock으로 대체하여 스케줄러 자체의 동작을 검증합니다:</p>
 * <ul>
 *   <li>lane 순차 실행과 재-arm</li>
 *   <li>미완료 엔트리 안전망</li>
 *   <li>실행 중 stats</li>
 *   <li>조회 payload 정규화</li>
 *   <li>타이머 예약 실패</li>
 *   <li>종료 처리</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BatchingRequestQueueTest {

    private static final long READ_DELAY_MS = 1000;
    private static final long WRITE_DELAY_MS = 10000;

    @Mock
    private BatchExecutor executor;

    private ManualBatchTimer timer;
    private BatchingRequestQueue queue;

    @BeforeEach
    void setUp() {
        timer = new ManualBatchTimer();
        queue = new BatchingRequestQueue(executor, timer, new BatchQueueConfig());
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    // ============================================================
    // 1. 타이머 arm
    // ============================================================

    @Test
    void submit_첫_요청만_lane_타이머를_arm함() {
        // when
        queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
        queue.submit(Action.FETCH_PAGE, PageQuery.of(10, 10));
        queue.submit(Action.ADD_TO_SELECTION, IdList.of(1));

        // then
        assertThat(timer.pendingTaskCount()).isEqualTo(2);
    }

    @Test
    void 배치_실행_중_들어온_요청은_실행이_끝난_뒤_한_윈도우_후에_발화함() {
        // given
        List<CompletableFuture<OperationResult>> lateArrivals = new ArrayList<>();
        doAnswer(invocation -> {
            Batch batch = invocation.getArgument(0);
            if (batch.sequence() == 1) {
                lateArrivals.add(queue.submit(Action.FETCH_PAGE, PageQuery.of(10, 10)));
                assertThat(timer.pendingTaskCount()).isZero();
            }
            resolveAll(batch);
            return null;
        }).when(executor).handleReadBatch(any());

        queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // when
        timer.advance(READ_DELAY_MS);

        // then
        assertThat(lateArrivals).hasSize(1);
        assertThat(lateArrivals.get(0)).isNotDone();
        assertThat(timer.pendingTaskCount()).isEqualTo(1);

        timer.advance(READ_DELAY_MS);
        assertThat(lateArrivals.get(0)).isDone();

        ArgumentCaptor<Batch> captor = ArgumentCaptor.forClass(Batch.class);
        verify(executor, times(2)).handleReadBatch(captor.capture());
        List<Batch> batches = captor.getAllValues();
        assertThat(batches).extracting(Batch::sequence).containsExactly(1L, 2L);
        assertThat(batches.get(1).firedAtNanos() - batches.get(0).firedAtNanos())
            .isEqualTo(TimeUnit.MILLISECONDS.toNanos(READ_DELAY_MS));
    }

    @Test
    void 실행_중인_배치_크기가_stats에_보임() {
        // given
        List<QueueStats> observed = new ArrayList<>();
        doAnswer(invocation -> {
            observed.add(queue.stats());
            resolveAll(invocation.getArgument(0));
            return null;
        }).when(executor).handleWriteBatch(any());

        queue.submit(Action.ADD_TO_SELECTION, IdList.of(1));
        queue.submit(Action.ADD_TO_SELECTION, IdList.of(2));
        queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // when
        timer.advance(WRITE_DELAY_MS);

        // then
        assertThat(observed).hasSize(1);
        assertThat(observed.get(0).runningWriteBatchSize()).isEqualTo(2);
        assertThat(observed.get(0).pendingWriteCount()).isZero();
        assertThat(queue.stats().runningWriteBatchSize()).isZero();
    }

    // ============================================================
    // 2. 미완료 엔트리 안전망
    // ============================================================

    @Test
    void 실행자가_완료하지_않은_엔트리는_내부_오류로_실패함() {
        // given
        CompletableFuture<OperationResult> future = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // when
        timer.advance(READ_DELAY_MS);

        // then
        verify(executor).handleReadBatch(any());
        assertThat(catchThrowable(future::join)).hasCauseInstanceOf(InternalOperationException.class);
    }

    @Test
    void 실행자가_예외를_던져도_모든_호출자가_실패를_받고_lane은_계속_동작함() {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        doThrow(boom).doAnswer(invocation -> {
            resolveAll(invocation.getArgument(0));
            return null;
        }).when(executor).handleReadBatch(any());

        CompletableFuture<OperationResult> first = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
        CompletableFuture<OperationResult> joined = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // when
        timer.advance(READ_DELAY_MS);
        CompletableFuture<OperationResult> next = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
        timer.advance(READ_DELAY_MS);

        // then
        Throwable thrown = catchThrowable(first::join);
        assertThat(thrown.getCause()).isInstanceOf(InternalOperationException.class).hasCause(boom);
        assertThat(catchThrowable(joined::join).getCause()).isSameAs(thrown.getCause());
        assertThat(next.join()).isInstanceOf(RecordPage.class);
    }

    // ============================================================
    // 3. 조회 payload 정규화
    // ============================================================

    @Test
    void null_페이지_조회와_기본_페이지_조회는_하나의_엔트리로_합쳐짐() {
        // given
        List<Batch> fired = new ArrayList<>();
        doAnswer(invocation -> {
            Batch batch = invocation.getArgument(0);
            fired.add(batch);
            resolveAll(batch);
            return null;
        }).when(executor).handleReadBatch(any());

        // when
        CompletableFuture<OperationResult> withoutPayload = queue.submit(Action.FETCH_PAGE, null);
        CompletableFuture<OperationResult> explicitDefault = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // then
        assertThat(queue.stats().pendingReadCount()).isEqualTo(1);

        timer.advance(READ_DELAY_MS);
        assertThat(fired).hasSize(1);
        assertThat(fired.get(0).entries()).hasSize(1);
        assertThat(fired.get(0).entries().get(0).payload()).isEqualTo(PageQuery.of(0, 10));
        assertThat(withoutPayload.join()).isSameAs(explicitDefault.join());
    }

    @Test
    void 최대값을_넘는_limit은_clamp된_limit과_하나의_엔트리로_합쳐짐() {
        // given
        List<Batch> fired = new ArrayList<>();
        doAnswer(invocation -> {
            Batch batch = invocation.getArgument(0);
            fired.add(batch);
            resolveAll(batch);
            return null;
        }).when(executor).handleReadBatch(any());

        // when
        queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 100));
        queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 500));
        timer.advance(READ_DELAY_MS);

        // then
        assertThat(fired).hasSize(1);
        PendingEntry entry = fired.get(0).entries().get(0);
        assertThat(fired.get(0).entries()).hasSize(1);
        assertThat(entry.waiterCount()).isEqualTo(2);
        assertThat(entry.key()).isEqualTo("FETCH_PAGE:0:100:");
    }

    // ============================================================
    // 4. 타이머 예약 실패
    // ============================================================

    @Test
    void 타이머가_예약을_거부하면_엔트리를_남기지_않고_즉시_실패함() {
        // given
        BatchTimer rejecting = new RejectableTimer(new ManualBatchTimer(), true);
        BatchingRequestQueue rejectingQueue = new BatchingRequestQueue(executor, rejecting, new BatchQueueConfig());

        // when
        CompletableFuture<OperationResult> first = rejectingQueue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
        CompletableFuture<OperationResult> second = rejectingQueue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // then
        assertThat(first).isCompletedExceptionally();
        assertThat(catchThrowable(first::join).getCause())
            .isInstanceOf(InternalOperationException.class)
            .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(second).isCompletedExceptionally();
        assertThat(rejectingQueue.stats().pendingCount()).isZero();

        rejectingQueue.close();
    }

    @Test
    void 배치_종료_후_재예약이_거부되면_남은_엔트리를_실패시킴() {
        // given
        ManualBatchTimer manual = new ManualBatchTimer();
        RejectableTimer rejectable = new RejectableTimer(manual, false);
        BatchingRequestQueue rejectingQueue = new BatchingRequestQueue(executor, rejectable, new BatchQueueConfig());
        List<CompletableFuture<OperationResult>> lateArrivals = new ArrayList<>();
        doAnswer(invocation -> {
            Batch batch = invocation.getArgument(0);
            if (batch.sequence() == 1) {
                lateArrivals.add(rejectingQueue.submit(Action.FETCH_PAGE, PageQuery.of(10, 10)));
                rejectable.rejecting = true;
            }
            resolveAll(batch);
            return null;
        }).when(executor).handleReadBatch(any());

        CompletableFuture<OperationResult> first = rejectingQueue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // when
        manual.advance(READ_DELAY_MS);

        // then
        assertThat(first.join()).isInstanceOf(RecordPage.class);
        assertThat(lateArrivals).hasSize(1);
        assertThat(catchThrowable(lateArrivals.get(0)::join).getCause())
            .isInstanceOf(InternalOperationException.class)
            .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(rejectingQueue.stats().isIdle()).isTrue();

        rejectingQueue.close();
    }

    // ============================================================
    // 5. 입력과 종료
    // ============================================================

    @Test
    void submit_action이_null이면_예외() {
        assertThatThrownBy(() -> queue.submit(null, PageQuery.of(0, 10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("action cannot be null");
    }

    @Test
    void close_대기_중인_엔트리를_실패시키고_타이머를_취소함() {
        // given
        CompletableFuture<OperationResult> read = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));
        CompletableFuture<OperationResult> write = queue.submit(Action.ADD_TO_SELECTION, IdList.of(1));

        // when
        queue.close();

        // then
        assertThat(catchThrowable(read::join).getCause())
            .isInstanceOf(InternalOperationException.class)
            .hasMessage("queue shut down");
        assertThat(write).isCompletedExceptionally();
        assertThat(timer.pendingTaskCount()).isZero();
        assertThat(queue.stats().isIdle()).isTrue();

        timer.advance(WRITE_DELAY_MS);
        verify(executor, never()).handleReadBatch(any());
        verify(executor, never()).handleWriteBatch(any());
    }

    @Test
    void close_이후_submit은_즉시_실패함() {
        // given
        queue.close();

        // when
        CompletableFuture<OperationResult> future = queue.submit(Action.FETCH_PAGE, PageQuery.of(0, 10));

        // then
        assertThat(future).isCompletedExceptionally();
        assertThat(timer.pendingTaskCount()).isZero();
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        BatchQueueConfig config = new BatchQueueConfig();
        assertThatThrownBy(() -> new BatchingRequestQueue(null, timer, config))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BatchingRequestQueue(executor, null, config))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BatchingRequestQueue(executor, timer, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RejectableTimer implements BatchTimer {

        private final ManualBatchTimer delegate;
        private volatile boolean rejecting;

        private RejectableTimer(ManualBatchTimer delegate, boolean rejecting) {
            this.delegate = delegate;
            this.rejecting = rejecting;
        }

        @Override
        public TimerHandle schedule(Runnable task, long delayMs) {
            if (rejecting) {
                throw new RejectedExecutionException("timer shut down");
            }
            return delegate.schedule(task, delayMs);
        }

        @Override
        public long nanoTime() {
            return delegate.nanoTime();
        }
    }

    private static void resolveAll(Batch batch) {
        for (PendingEntry entry : batch.entries()) {
            entry.complete(new RecordPage(List.of(), PageInfo.of(0, 10, 0)));
        }
    }
}
