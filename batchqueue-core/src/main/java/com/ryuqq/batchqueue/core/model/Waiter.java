package com.ryuqq.batchqueue.core.model;

import com.ryuqq.batchqueue.core.result.OperationResult;

import java.util.concurrent.CompletableFuture;

/**
 * PendingEntry에 합류한 개별 호출자.
 *
 * @param completion 호출자에게 반환된 future
 * @param joinedAtNanos 합류 시각 (monotonic)
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record Waiter(CompletableFuture<OperationResult> completion, long joinedAtNanos) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException completion이 null인 경우
     */
    public Waiter {
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
    }

    /**
     * 새 future를 가진 Waiter 생성.
     *
     * @param joinedAtNanos 합류 시각
     * @return Waiter
     */
    public static Waiter joinedAt(long joinedAtNanos) {
        return new Waiter(new CompletableFuture<>(), joinedAtNanos);
    }
}
