package com.ryuqq.batchqueue.core.result;

import java.util.List;

/**
 * REORDER_SELECTION 결과.
 *
 * @param message 요약 메시지
 * @param selectedIds 새 선택 순서
 * @param total 선택 건수
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record ReorderResult(String message, List<Long> selectedIds, int total) implements OperationResult {

    public ReorderResult {
        selectedIds = List.copyOf(selectedIds);
    }
}
