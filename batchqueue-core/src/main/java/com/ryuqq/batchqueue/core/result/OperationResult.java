package com.ryuqq.batchqueue.core.result;

/**
 * 액션 실행 결과.
 *
 * <p>결과 타입은 액션에 따라 다릅니다:</p>
 * <ul>
 *   <li>FETCH_PAGE → {@link RecordPage}</li>
 *   <li>FETCH_SELECTION → {@link SelectionPage}</li>
 *   <li>ADD_TO_SELECTION → {@link SelectionAddResult}</li>
 *   <li>REORDER_SELECTION → {@link ReorderResult}</li>
 *   <li>REMOVE_FROM_SELECTION → {@link RemovalResult}</li>
 *   <li>CREATE_RECORD → {@link CreatedRecord}</li>
 *   <li>중복 WRITE → {@link DuplicateWriteSuppressed} (모든 WRITE 액션 공통)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 결과 타입이 이 패키지에 고정됩니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public sealed interface OperationResult
    permits RecordPage, SelectionPage, SelectionAddResult, ReorderResult,
            RemovalResult, CreatedRecord, DuplicateWriteSuppressed {

    /**
     * 중복 억제 결과인지 확인.
     *
     * @return 중복 억제된 WRITE이면 true
     */
    default boolean isSuppressed() {
        return this instanceof DuplicateWriteSuppressed;
    }
}
