package com.ryuqq.batchqueue.core.model;

/**
 * 전체 레코드 조회 조건 (필터 + 페이지 윈도우).
 *
 * <p>서로 다른 페이지 윈도우는 서로 다른 요청이며, 동일한 윈도우는 하나로 합쳐집니다.</p>
 *
 * @param offset 시작 위치 (0 이상)
 * @param limit 페이지 크기 (1 이상, 실행 시 최대값으로 clamp)
 * @param filter 부분 일치 필터 (null 또는 빈 문자열이면 필터 없음)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record PageQuery(int offset, int limit, String filter) implements OperationPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException offset이 음수이거나 limit이 1 미만인 경우
     */
    public PageQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (current: " + offset + ")");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1 (current: " + limit + ")");
        }
    }

    /**
     * 필터 없는 조회 조건 생성.
     *
     * @param offset 시작 위치
     * @param limit 페이지 크기
     * @return PageQuery
     */
    public static PageQuery of(int offset, int limit) {
        return new PageQuery(offset, limit, null);
    }

    /**
     * 정규화된 필터 조회 (trim + 소문자, null은 빈 문자열).
     *
     * @return 정규화된 필터
     */
    public String normalizedFilter() {
        return filter == null ? "" : filter.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
