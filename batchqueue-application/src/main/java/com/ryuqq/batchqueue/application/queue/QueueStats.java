package com.ryuqq.batchqueue.application.queue;

/**
 * 큐 관측 스냅샷.
 *
 * @param pendingCount 대기 중인 엔트리 수 (READ + WRITE)
 * @param pendingReadCount 대기 중인 READ 엔트리 수
 * @param pendingWriteCount 대기 중인 WRITE 엔트리 수
 * @param runningReadBatchSize 실행 중인 READ 배치 크기 (없으면 0)
 * @param runningWriteBatchSize 실행 중인 WRITE 배치 크기 (없으면 0)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record QueueStats(
    int pendingCount,
    int pendingReadCount,
    int pendingWriteCount,
    int runningReadBatchSize,
    int runningWriteBatchSize
) {

    /**
     * 대기/실행 중인 작업이 없는지 확인.
     *
     * @return 모두 0이면 true
     */
    public boolean isIdle() {
        return pendingCount == 0 && runningReadBatchSize == 0 && runningWriteBatchSize == 0;
    }
}
