package com.ryuqq.batchqueue.core.model;

/**
 * 스케줄러가 받는 6가지 도메인 액션.
 *
 * <p>각 액션은 고정된 정적 테이블로 {@link OperationClass}와 허용 Payload 타입을 가집니다.
 * 조회(fetch)는 READ, 변경(mutate)은 WRITE입니다.</p>
 *
 * <pre>
 * FETCH_PAGE             READ   PageQuery
 * FETCH_SELECTION        READ   SelectionQuery
 * ADD_TO_SELECTION       WRITE  IdList
 * REORDER_SELECTION      WRITE  IdList
 * REMOVE_FROM_SELECTION  WRITE  IdList
 * CREATE_RECORD          WRITE  NewRecord
 * </pre>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public enum Action {

    FETCH_PAGE(OperationClass.READ, PageQuery.class),
    FETCH_SELECTION(OperationClass.READ, SelectionQuery.class),
    ADD_TO_SELECTION(OperationClass.WRITE, IdList.class),
    REORDER_SELECTION(OperationClass.WRITE, IdList.class),
    REMOVE_FROM_SELECTION(OperationClass.WRITE, IdList.class),
    CREATE_RECORD(OperationClass.WRITE, NewRecord.class);

    private final OperationClass operationClass;
    private final Class<? extends OperationPayload> payloadType;

    Action(OperationClass operationClass, Class<? extends OperationPayload> payloadType) {
        this.operationClass = operationClass;
        this.payloadType = payloadType;
    }

    /**
     * 액션의 배치 레인 조회.
     *
     * @return READ 또는 WRITE
     */
    public OperationClass operationClass() {
        return operationClass;
    }

    /**
     * 액션이 허용하는 Payload 타입 조회.
     *
     * @return Payload 클래스
     */
    public Class<? extends OperationPayload> payloadType() {
        return payloadType;
    }

    /**
     * 주어진 Payload를 이 액션이 처리할 수 있는지 확인.
     *
     * @param payload 검사할 Payload (null 불가)
     * @return 타입이 일치하면 true
     */
    public boolean accepts(OperationPayload payload) {
        return payloadType.isInstance(payload);
    }
}
