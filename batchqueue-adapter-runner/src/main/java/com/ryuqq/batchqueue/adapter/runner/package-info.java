/**
 * 요청 병합 스케줄러 런타임.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.adapter.runner.BatchingRequestQueue} - dedup registry, READ/WRITE lane, 배치 발화</li>
 *   <li>{@link com.ryuqq.batchqueue.adapter.runner.ScheduledBatchTimer} - ScheduledThreadPoolExecutor 기반 타이머</li>
 *   <li>{@link com.ryuqq.batchqueue.adapter.runner.BatchQueueConfig} - 배치 윈도우, 페이지, 시드 설정</li>
 *   <li>{@link com.ryuqq.batchqueue.adapter.runner.BatchQueueContext} - 프로세스 단위 조립</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.adapter.runner;
