package com.ryuqq.batchqueue.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * 레코드 ID 목록 (선택 추가/재정렬/제거 입력).
 *
 * <p>목록은 방어적으로 복사되어 불변입니다. 빈 목록은 허용되며,
 * 빈 목록 거부는 핸들러가 validation error로 처리합니다.</p>
 *
 * @param ids ID 목록 (null 불가, null 원소 불가)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record IdList(List<Long> ids) implements OperationPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ids가 null이거나 null 원소를 포함하는 경우
     */
    public IdList {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (ids.stream().anyMatch(id -> id == null)) {
            throw new IllegalArgumentException("ids cannot contain null");
        }
        ids = List.copyOf(ids);
    }

    /**
     * 가변 인자로 생성.
     *
     * @param ids ID 목록
     * @return IdList
     */
    public static IdList of(long... ids) {
        return new IdList(Arrays.stream(ids).boxed().toList());
    }

    /**
     * 목록이 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
