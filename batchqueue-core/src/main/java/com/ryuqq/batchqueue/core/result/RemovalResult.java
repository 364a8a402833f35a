package com.ryuqq.batchqueue.core.result;

/**
 * REMOVE_FROM_SELECTION 결과.
 *
 * <p>부분 제거도 성공입니다.</p>
 *
 * <p>요청 ID는 집계 전에 중복을 제거합니다. [5, 5]처럼 같은 ID를 반복해도 한 건으로 세므로,
 * 5가 선택되어 있지 않으면 notFound는 2가 아니라 1입니다.</p>
 *
 * @param message 요약 메시지
 * @param removed 실제 제거된 건수
 * @param notFound 요청했지만 선택되어 있지 않던 (서로 다른) ID 수
 * @param totalSelected 처리 후 선택 건수
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record RemovalResult(String message, int removed, int notFound, int totalSelected) implements OperationResult {
}
