package com.ryuqq.batchqueue.core.error;

/**
 * 생성 시 ID 충돌.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public class ConflictException extends QueueOperationException {

    private final long conflictingId;

    public ConflictException(long conflictingId) {
        super(ErrorCode.CONFLICT, "Record already exists",
            "Record with ID " + conflictingId + " already exists", null);
        this.conflictingId = conflictingId;
    }

    public long conflictingId() {
        return conflictingId;
    }
}
