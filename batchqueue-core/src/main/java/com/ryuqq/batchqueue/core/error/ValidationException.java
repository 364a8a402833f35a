package com.ryuqq.batchqueue.core.error;

/**
 * 입력 검증 실패.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public class ValidationException extends QueueOperationException {

    public ValidationException(String message, String details) {
        this(message, details, null);
    }

    public ValidationException(String message, String details, Throwable cause) {
        super(ErrorCode.VALIDATION, message, details, cause);
    }
}
