package com.ryuqq.batchqueue.core.error;

/**
 * 오류 분류.
 *
 * <p>transport 계층이 응답 상태를 결정할 수 있도록 HTTP 상태 코드를 함께 가집니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 잘못되었거나 일관되지 않은 입력 (잘못된 순서 목록, 빈 ID 목록 등).
     */
    VALIDATION(400),

    /**
     * 참조한 ID가 store 또는 선택 목록에 없음.
     */
    NOT_FOUND(404),

    /**
     * 생성 시 ID 충돌.
     */
    CONFLICT(409),

    /**
     * 예상하지 못한 핸들러 오류.
     */
    INTERNAL(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
