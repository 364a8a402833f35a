package com.ryuqq.batchqueue.core.result;

import com.ryuqq.batchqueue.core.model.StoredRecord;

import java.util.List;

/**
 * FETCH_PAGE 결과.
 *
 * @param records 페이지 레코드
 * @param page 페이지 메타데이터
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record RecordPage(List<StoredRecord> records, PageInfo page) implements OperationResult {

    public RecordPage {
        records = List.copyOf(records);
    }
}
