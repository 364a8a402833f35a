/**
 * 액션별 실행 결과 타입.
 *
 * <p>{@link com.ryuqq.batchqueue.core.result.OperationResult}는 sealed interface이며,
 * 동일 엔트리의 모든 Waiter는 같은 결과 인스턴스를 받습니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.core.result;
