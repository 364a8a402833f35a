package com.ryuqq.batchqueue.core.model;

/**
 * 선택 목록 조회 조건.
 *
 * @param offset 시작 위치 (0 이상)
 * @param limit 페이지 크기 (1 이상)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record SelectionQuery(int offset, int limit) implements OperationPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException offset이 음수이거나 limit이 1 미만인 경우
     */
    public SelectionQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (current: " + offset + ")");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1 (current: " + limit + ")");
        }
    }
}
