package com.ryuqq.batchqueue.core.model;

/**
 * 페이지 크기 정책.
 *
 * @param defaultLimit payload가 없을 때 사용할 페이지 크기
 * @param maxLimit 허용되는 최대 페이지 크기 (초과 요청은 clamp)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record PageLimits(int defaultLimit, int maxLimit) {

    /**
     * 기본 정책 생성자 (default 10, max 100).
     */
    public PageLimits() {
        this(10, 100);
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 양수가 아니거나 defaultLimit이 maxLimit보다 큰 경우
     */
    public PageLimits {
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("defaultLimit must be positive (current: " + defaultLimit + ")");
        }
        if (maxLimit < defaultLimit) {
            throw new IllegalArgumentException(
                "maxLimit must be >= defaultLimit (default: " + defaultLimit + ", max: " + maxLimit + ")"
            );
        }
    }

    /**
     * 요청 limit을 최대값으로 제한.
     *
     * @param requested 요청된 limit
     * @return min(requested, maxLimit)
     */
    public int clamp(int requested) {
        return Math.min(requested, maxLimit);
    }

    /**
     * 조회 payload를 실행 시 적용되는 형태로 정규화.
     *
     * <p>null payload는 기본 조회 조건(offset 0, defaultLimit)으로, maxLimit을 넘는 limit은
     * clamp된 값으로 바꿉니다. 결과가 같은 조회는 dedup key도 같아야 하므로 키 도출 전에 적용합니다.
     * 조회가 아닌 액션의 payload는 그대로 반환합니다.</p>
     *
     * @param action 액션 (null 불가)
     * @param payload Payload (null 허용)
     * @return 정규화된 Payload
     * @throws IllegalArgumentException action이 null인 경우
     */
    public OperationPayload normalize(Action action, OperationPayload payload) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (action == Action.FETCH_PAGE) {
            if (payload == null) {
                return PageQuery.of(0, defaultLimit);
            }
            if (payload instanceof PageQuery query && query.limit() > maxLimit) {
                return new PageQuery(query.offset(), maxLimit, query.filter());
            }
        }
        if (action == Action.FETCH_SELECTION) {
            if (payload == null) {
                return new SelectionQuery(0, defaultLimit);
            }
            if (payload instanceof SelectionQuery query && query.limit() > maxLimit) {
                return new SelectionQuery(query.offset(), maxLimit);
            }
        }
        return payload;
    }
}
