package com.ryuqq.batchqueue.core.model;

import java.util.List;

/**
 * 타이머 발화 시점의 불변 배치 스냅샷.
 *
 * <p>레지스트리에서 drain된 한 클래스의 엔트리들을 담으며, Executor가 한 번 소비한 뒤 폐기됩니다.
 * 배치는 재실행되지 않습니다.</p>
 *
 * @param operationClass READ 또는 WRITE
 * @param entries drain된 엔트리 (불변)
 * @param firedAtNanos 발화 시각 (monotonic)
 * @param sequence 클래스별 배치 순번 (1부터 시작)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record Batch(OperationClass operationClass, List<PendingEntry> entries, long firedAtNanos, long sequence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operationClass 또는 entries가 null이거나,
     *                                  다른 클래스의 엔트리가 섞인 경우
     */
    public Batch {
        if (operationClass == null) {
            throw new IllegalArgumentException("operationClass cannot be null");
        }
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        for (PendingEntry entry : entries) {
            if (entry.operationClass() != operationClass) {
                throw new IllegalArgumentException(
                    "Batch of " + operationClass + " cannot contain " + entry.action() + " entry"
                );
            }
        }
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
