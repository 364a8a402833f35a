package com.ryuqq.batchqueue.core.result;

import com.ryuqq.batchqueue.core.model.StoredRecord;

/**
 * CREATE_RECORD 결과.
 *
 * @param message 요약 메시지
 * @param record 생성된 레코드
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record CreatedRecord(String message, StoredRecord record) implements OperationResult {
}
