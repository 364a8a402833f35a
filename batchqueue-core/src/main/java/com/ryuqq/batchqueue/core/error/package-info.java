/**
 * 오류 분류 체계.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.core.error.ValidationException} - VALIDATION (400)</li>
 *   <li>{@link com.ryuqq.batchqueue.core.error.NotFoundException} - NOT_FOUND (404)</li>
 *   <li>{@link com.ryuqq.batchqueue.core.error.ConflictException} - CONFLICT (409)</li>
 *   <li>{@link com.ryuqq.batchqueue.core.error.InternalOperationException} - INTERNAL (500)</li>
 * </ul>
 *
 * <p>자동 재시도는 없습니다. 실패한 엔트리의 호출자는 다시 submit해야 합니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.core.error;
