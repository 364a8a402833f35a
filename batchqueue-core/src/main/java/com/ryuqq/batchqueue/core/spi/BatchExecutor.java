package com.ryuqq.batchqueue.core.spi;

import com.ryuqq.batchqueue.core.model.Batch;

/**
 * 배치 실행 전략.
 *
 * <p>스케줄러는 생성 시점에 이 구현체를 주입받으며(composition), 타이머가 발화하면
 * drain된 배치를 클래스에 맞는 메서드로 넘깁니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>배치의 각 엔트리를 독립적으로 처리</li>
 *   <li>성공 시 {@code entry.complete(result)}, 실패 시 {@code entry.fail(error)}</li>
 *   <li>한 엔트리의 실패가 나머지 엔트리 처리를 중단시키지 않음</li>
 * </ul>
 *
 * <p>반환 시점까지 완료되지 않은 엔트리나 메서드가 던진 예외는 스케줄러가
 * internal error로 거부 처리합니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public interface BatchExecutor {

    /**
     * READ 배치 처리.
     *
     * @param batch READ 엔트리 배치
     */
    void handleReadBatch(Batch batch);

    /**
     * WRITE 배치 처리.
     *
     * @param batch WRITE 엔트리 배치
     */
    void handleWriteBatch(Batch batch);
}
