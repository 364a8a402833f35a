package com.ryuqq.batchqueue.core.model;

/**
 * Operation 분류 (배치 레인).
 *
 * <p>READ와 WRITE는 서로 독립된 타이머와 배치 윈도우를 가집니다.</p>
 *
 * <ul>
 *   <li>READ: 짧은 윈도우, 동일 요청은 하나의 엔트리에 합류(join)</li>
 *   <li>WRITE: 긴 윈도우, 동일 요청은 즉시 중복 억제(suppress)</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public enum OperationClass {

    /**
     * 조회 계열 (store 변경 없음).
     */
    READ,

    /**
     * 변경 계열 (store 변경).
     */
    WRITE;

    /**
     * READ 레인인지 확인.
     *
     * @return READ인 경우 true
     */
    public boolean isRead() {
        return this == READ;
    }
}
