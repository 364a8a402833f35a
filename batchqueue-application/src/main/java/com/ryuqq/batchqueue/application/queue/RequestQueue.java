package com.ryuqq.batchqueue.application.queue;

import com.ryuqq.batchqueue.core.model.Action;
import com.ryuqq.batchqueue.core.model.OperationPayload;
import com.ryuqq.batchqueue.core.result.OperationResult;

import java.util.concurrent.CompletableFuture;

/**
 * 요청 병합(coalescing) 큐.
 *
 * <p>transport에 독립적인 유일한 진입점입니다. 동일한 요청은 중복 제거되고,
 * 대기 중인 요청은 READ/WRITE 배치 윈도우 단위로 한 번만 실행된 뒤
 * 그 결과가 모든 호출자에게 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompletableFuture&lt;OperationResult&gt; future =
 *     queue.submit(Action.FETCH_PAGE, new PageQuery(0, 20, "category 7"));
 *
 * RecordPage page = (RecordPage) future.join();
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public interface RequestQueue {

    /**
     * 작업 제출.
     *
     * <p>즉시 반환되며, 실제 실행과 결과 전달은 해당 클래스의 타이머가 발화할 때 비동기로 일어납니다.</p>
     *
     * <ul>
     *   <li>같은 키의 READ가 대기 중이면 합류하여 같은 결과를 받음</li>
     *   <li>같은 키의 WRITE가 대기 중이면 {@code DuplicateWriteSuppressed}로 즉시 완료</li>
     *   <li>payload 타입이 액션과 맞지 않으면 {@code ValidationException}으로 즉시 실패</li>
     * </ul>
     *
     * @param action 액션
     * @param payload 액션별 입력 (READ 액션은 null 허용: 기본 페이지)
     * @return 결과 future (취소 불가)
     * @throws IllegalArgumentException action이 null인 경우
     */
    CompletableFuture<OperationResult> submit(Action action, OperationPayload payload);

    /**
     * 큐 상태 조회 (부수 효과 없음).
     *
     * @return 현재 통계
     */
    QueueStats stats();
}
