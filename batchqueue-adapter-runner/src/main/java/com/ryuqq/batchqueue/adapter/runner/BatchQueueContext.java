package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.adapter.inmemory.store.InMemoryRecordStore;
import com.ryuqq.batchqueue.application.executor.RecordBatchExecutor;
import com.ryuqq.batchqueue.application.executor.RecordOperationHandlers;
import com.ryuqq.batchqueue.application.queue.RecordQueueClient;
import com.ryuqq.batchqueue.core.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로세스 단위 조립 객체.
 *
 * <p>store, executor, timer, queue, client를 한 번 조립하여 transport 계층에 넘깁니다.
 * 전역 싱글톤 대신 이 객체를 명시적으로 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (BatchQueueContext context = BatchQueueContext.create(BatchQueueConfig.load())) {
 *     RecordPage page = context.client().fetchPage(0, 20, "category 7").join();
 * }
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class BatchQueueContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchQueueContext.class);

    private final BatchQueueConfig config;
    private final RecordStore store;
    private final ScheduledBatchTimer timer;
    private final BatchingRequestQueue queue;
    private final RecordQueueClient client;

    private BatchQueueContext(BatchQueueConfig config, RecordStore store) {
        this.config = config;
        this.store = store;
        this.timer = new ScheduledBatchTimer(config.timerThreads());
        RecordBatchExecutor executor = new RecordBatchExecutor(new RecordOperationHandlers(store, config.pageLimits()));
        this.queue = new BatchingRequestQueue(executor, timer, config);
        this.client = new RecordQueueClient(queue, config.pageLimits());
    }

    /**
     * seedRecordCount만큼 생성된 InMemoryRecordStore로 조립.
     *
     * @param config 설정
     * @return 컨텍스트
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static BatchQueueContext create(BatchQueueConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return create(config, InMemoryRecordStore.seeded(config.seedRecordCount()));
    }

    /**
     * 주어진 store로 조립.
     *
     * @param config 설정
     * @param store 레코드 저장소
     * @return 컨텍스트
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static BatchQueueContext create(BatchQueueConfig config, RecordStore store) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        BatchQueueContext context = new BatchQueueContext(config, store);
        log.info("Batch queue started (read window {}ms, write window {}ms, {} records)",
            config.readDelayMs(), config.writeDelayMs(), store.size());
        return context;
    }

    public BatchQueueConfig config() {
        return config;
    }

    public RecordStore store() {
        return store;
    }

    public BatchingRequestQueue queue() {
        return queue;
    }

    public RecordQueueClient client() {
        return client;
    }

    /**
     * 큐를 닫고 (대기 엔트리 실패 처리) 타이머 스레드를 종료합니다.
     */
    @Override
    public void close() {
        queue.close();
        timer.close();
    }
}
