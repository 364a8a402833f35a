package com.ryuqq.batchqueue.application.queue;

import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.IdList;
import com.ryuqq.batchqueue.core.model.NewRecord;
import com.ryuqq.batchqueue.core.model.PageLimits;
import com.ryuqq.batchqueue.core.model.PageQuery;
import com.ryuqq.batchqueue.core.model.SelectionQuery;
import com.ryuqq.batchqueue.core.result.OperationResult;
import com.ryuqq.batchqueue.core.result.RecordPage;
import com.ryuqq.batchqueue.core.result.SelectionPage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RequestQueue} 위의 타입 안전한 클라이언트.
 *
 * <p>transport 계층(HTTP 컨트롤러 등)이 호출하는 용도입니다. 조회는 결과 타입으로 변환된
 * future를 반환하고, 변경은 중복 억제 결과가 올 수 있으므로 {@link OperationResult}를 그대로 반환합니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class RecordQueueClient {

    private final RequestQueue queue;
    private final PageLimits pageLimits;

    /**
     * 생성자.
     *
     * @param queue 요청 큐
     * @param pageLimits 페이지 기본값 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RecordQueueClient(RequestQueue queue, PageLimits pageLimits) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (pageLimits == null) {
            throw new IllegalArgumentException("pageLimits cannot be null");
        }
        this.queue = queue;
        this.pageLimits = pageLimits;
    }

    /**
     * 전체 레코드 페이지 조회.
     *
     * @param offset 시작 위치 (null이면 0)
     * @param limit 페이지 크기 (null이면 기본값)
     * @param filter 부분 일치 필터 (null 허용)
     * @return 페이지 future
     */
    public CompletableFuture<RecordPage> fetchPage(Integer offset, Integer limit, String filter) {
        PageQuery query = new PageQuery(offsetOrDefault(offset), limitOrDefault(limit), filter);
        return queue.submit(Action.FETCH_PAGE, query).thenApply(RecordPage.class::cast);
    }

    /**
     * 선택 목록 페이지 조회.
     *
     * @param offset 시작 위치 (null이면 0)
     * @param limit 페이지 크기 (null이면 기본값)
     * @return 선택 페이지 future
     */
    public CompletableFuture<SelectionPage> fetchSelection(Integer offset, Integer limit) {
        SelectionQuery query = new SelectionQuery(offsetOrDefault(offset), limitOrDefault(limit));
        return queue.submit(Action.FETCH_SELECTION, query).thenApply(SelectionPage.class::cast);
    }

    public CompletableFuture<OperationResult> addToSelection(List<Long> ids) {
        return queue.submit(Action.ADD_TO_SELECTION, new IdList(ids));
    }

    public CompletableFuture<OperationResult> reorderSelection(List<Long> ids) {
        return queue.submit(Action.REORDER_SELECTION, new IdList(ids));
    }

    public CompletableFuture<OperationResult> removeFromSelection(List<Long> ids) {
        return queue.submit(Action.REMOVE_FROM_SELECTION, new IdList(ids));
    }

    public CompletableFuture<OperationResult> createRecord(NewRecord newRecord) {
        return queue.submit(Action.CREATE_RECORD, newRecord);
    }

    private int offsetOrDefault(Integer offset) {
        return offset == null ? 0 : offset;
    }

    private int limitOrDefault(Integer limit) {
        return limit == null ? pageLimits.defaultLimit() : limit;
    }
}
