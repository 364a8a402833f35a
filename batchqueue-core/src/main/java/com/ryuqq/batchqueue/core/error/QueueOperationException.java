package com.ryuqq.batchqueue.core.error;

/**
 * 큐 작업 실패의 공통 상위 예외.
 *
 * <p>실패한 엔트리의 모든 Waiter에게 동일한 인스턴스가 전달됩니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public abstract class QueueOperationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    protected QueueOperationException(ErrorCode errorCode, String message, String details, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * 상세 설명 조회.
     *
     * @return 상세 설명 (null 가능)
     */
    public String details() {
        return details;
    }
}
