package com.ryuqq.batchqueue.application.executor;

import com.ryuqq.batchqueue.core.error.InternalOperationException;
import com.ryuqq.batchqueue.core.error.QueueOperationException;
import com.ryuqq.batchqueue.core.model.Batch;
import com.ryuqq.batchqueue.core.model.OperationClass;
import com.ryuqq.batchqueue.core.model.PendingEntry;
import com.ryuqq.batchqueue.core.result.OperationResult;
import com.ryuqq.batchqueue.core.spi.BatchExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 레코드 도메인 배치 실행자.
 *
 * <p>배치의 각 엔트리를 {@link RecordOperationHandlers}로 실행하고 결과를 모든 Waiter에게 전달합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * For each PendingEntry in batch:
 *   1. handlers.handle(action, payload)
 *   2. 성공 → entry.complete(result)     (모든 Waiter가 같은 인스턴스)
 *   3. 도메인 예외 → entry.fail(e)        (VALIDATION, NOT_FOUND, CONFLICT)
 *   4. 그 외 예외 → entry.fail(InternalOperationException)
 *   5. 다음 엔트리 계속 진행
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class RecordBatchExecutor implements BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(RecordBatchExecutor.class);

    private final RecordOperationHandlers handlers;

    /**
     * 생성자.
     *
     * @param handlers 도메인 핸들러
     * @throws IllegalArgumentException handlers가 null인 경우
     */
    public RecordBatchExecutor(RecordOperationHandlers handlers) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        this.handlers = handlers;
    }

    @Override
    public void handleReadBatch(Batch batch) {
        requireClass(batch, OperationClass.READ);
        process(batch);
    }

    @Override
    public void handleWriteBatch(Batch batch) {
        requireClass(batch, OperationClass.WRITE);
        process(batch);
    }

    private void process(Batch batch) {
        log.debug("Processing {} batch #{} with {} entries", batch.operationClass(), batch.sequence(), batch.size());
        for (PendingEntry entry : batch.entries()) {
            execute(entry);
        }
    }

    /**
     * 개별 엔트리 실행.
     *
     * <p>예외가 발생해도 다음 엔트리 처리를 방해하지 않습니다.</p>
     *
     * @param entry 실행할 엔트리
     */
    private void execute(PendingEntry entry) {
        try {
            OperationResult result = handlers.handle(entry.action(), entry.payload());
            entry.complete(result);
            log.debug("{} completed for {} waiters", entry.key(), entry.waiterCount());
        } catch (QueueOperationException e) {
            entry.fail(e);
            log.warn("{} rejected for {} waiters: {} - {}", entry.key(), entry.waiterCount(), e.getMessage(), e.details());
        } catch (RuntimeException e) {
            entry.fail(new InternalOperationException("Unexpected failure while executing " + entry.action(), e));
            log.error("{} failed unexpectedly", entry.key(), e);
        }
    }

    private static void requireClass(Batch batch, OperationClass expected) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        if (batch.operationClass() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " batch but got " + batch.operationClass());
        }
    }
}
