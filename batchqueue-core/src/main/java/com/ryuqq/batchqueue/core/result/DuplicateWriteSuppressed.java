package com.ryuqq.batchqueue.core.result;

/**
 * 중복 WRITE 억제 결과 (sentinel).
 *
 * <p>동일한 키의 WRITE가 이미 대기 중일 때 새 호출자는 이 결과로 즉시 완료됩니다.
 * 대기 중인 원본 엔트리는 영향을 받지 않으며, 새 호출자의 의도는 원본 실행 결과에 합쳐지지 않습니다.</p>
 *
 * @param key 충돌한 중복 제거 키
 * @param message 안내 메시지
 * @param suppressedAtMillis 억제 시각 (epoch millis)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record DuplicateWriteSuppressed(String key, String message, long suppressedAtMillis) implements OperationResult {

    /**
     * 기본 메시지로 생성.
     *
     * @param key 중복 제거 키
     * @return DuplicateWriteSuppressed
     */
    public static DuplicateWriteSuppressed of(String key) {
        return new DuplicateWriteSuppressed(key, "Duplicate write ignored", System.currentTimeMillis());
    }
}
