package com.ryuqq.batchqueue.core.result;

/**
 * 페이지 메타데이터.
 *
 * @param offset 시작 위치
 * @param limit 적용된 페이지 크기 (clamp 이후)
 * @param total 전체 건수
 * @param hasMore offset + limit &lt; total
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record PageInfo(int offset, int limit, int total, boolean hasMore) {

    /**
     * 메타데이터 계산.
     *
     * @param offset 시작 위치
     * @param limit 적용된 페이지 크기
     * @param total 전체 건수
     * @return PageInfo
     */
    public static PageInfo of(int offset, int limit, int total) {
        return new PageInfo(offset, limit, total, (long) offset + limit < total);
    }
}
