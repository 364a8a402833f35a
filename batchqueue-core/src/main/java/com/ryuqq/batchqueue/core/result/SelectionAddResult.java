package com.ryuqq.batchqueue.core.result;

import java.util.List;

/**
 * ADD_TO_SELECTION 결과.
 *
 * @param message 요약 메시지
 * @param added 새로 추가된 ID
 * @param alreadySelected 이미 선택되어 있던 ID
 * @param totalSelected 처리 후 선택 건수
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record SelectionAddResult(
    String message,
    List<Long> added,
    List<Long> alreadySelected,
    int totalSelected
) implements OperationResult {

    public SelectionAddResult {
        added = List.copyOf(added);
        alreadySelected = List.copyOf(alreadySelected);
    }
}
