package com.ryuqq.batchqueue.core.result;

import com.ryuqq.batchqueue.core.model.StoredRecord;

import java.util.List;

/**
 * FETCH_SELECTION 결과.
 *
 * @param records 페이지 범위의 선택 레코드 (선택 순서)
 * @param selectedIds 전체 선택 ID 목록 (페이지네이션 미적용)
 * @param page 페이지 메타데이터 (total = 선택 건수)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record SelectionPage(List<StoredRecord> records, List<Long> selectedIds, PageInfo page) implements OperationResult {

    public SelectionPage {
        records = List.copyOf(records);
        selectedIds = List.copyOf(selectedIds);
    }
}
