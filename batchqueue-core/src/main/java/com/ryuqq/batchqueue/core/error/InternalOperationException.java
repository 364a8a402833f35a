package com.ryuqq.batchqueue.core.error;

/**
 * 예상하지 못한 핸들러 오류 또는 스케줄러 내부 오류.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public class InternalOperationException extends QueueOperationException {

    public InternalOperationException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL, message, cause == null ? null : cause.toString(), cause);
    }

    public InternalOperationException(String message) {
        this(message, null);
    }
}
