/**
 * Application API - 요청 병합 큐 인터페이스와 타입 안전 클라이언트.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BatchingRequestQueue)
 *   ↓ implements
 * application (RequestQueue, RecordQueueClient)
 *   ↓ depends on
 * core (Action, OperationPayload, OperationResult, spi)
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.application.queue;
