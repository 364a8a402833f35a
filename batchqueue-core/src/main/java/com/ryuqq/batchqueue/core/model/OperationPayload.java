package com.ryuqq.batchqueue.core.model;

/**
 * 액션별 입력 데이터의 마커 인터페이스.
 *
 * <p>구현체는 불변이어야 하며, 중복 제거 키는 {@link DedupKeys}가 구현체의 형태에 따라 도출합니다.
 * 알려지지 않은 구현체는 Jackson canonical JSON으로 직렬화되어 키가 됩니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public interface OperationPayload {
}
