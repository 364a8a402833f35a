/**
 * 레코드 도메인 배치 실행 전략.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.application.executor.RecordBatchExecutor} - 엔트리별 실행, fan-out, 실패 격리</li>
 *   <li>{@link com.ryuqq.batchqueue.application.executor.RecordOperationHandlers} - 6가지 액션 핸들러</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.application.executor;
