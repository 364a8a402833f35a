package com.ryuqq.batchqueue.core.model;

import com.ryuqq.batchqueue.core.result.OperationResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 대기 중인 논리 요청 (중복 제거 키당 하나).
 *
 * <p>하나의 결과 슬롯과 여러 Waiter를 가지는 브로드캐스트 완료 레코드입니다.
 * {@link #complete(OperationResult)} 또는 {@link #fail(Throwable)} 중 최초 한 번만 반영되며,
 * 모든 Waiter가 동일한 결과 인스턴스(또는 동일한 예외 인스턴스)를 받습니다.
 * 완료 후에도 결과를 조회할 수 있습니다.</p>
 *
 * <p><strong>동시성:</strong> Waiter 추가는 스케줄러 lock 안에서만 일어나며,
 * 배치로 drain된 후에는 더 이상 추가되지 않습니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public final class PendingEntry {

    private final String key;
    private final Action action;
    private final OperationPayload payload;
    private final long createdAtNanos;
    private final List<Waiter> waiters;
    private final AtomicBoolean done;

    private volatile long lastJoinedAtNanos;
    private volatile OperationResult result;
    private volatile Throwable error;

    /**
     * 생성자 (최초 Waiter 포함).
     *
     * @param key 중복 제거 키
     * @param action 액션
     * @param payload Payload (null 허용)
     * @param firstWaiter 최초 호출자
     * @throws IllegalArgumentException key, action, firstWaiter가 null인 경우
     */
    public PendingEntry(String key, Action action, OperationPayload payload, Waiter firstWaiter) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (firstWaiter == null) {
            throw new IllegalArgumentException("firstWaiter cannot be null");
        }
        this.key = key;
        this.action = action;
        this.payload = payload;
        this.createdAtNanos = firstWaiter.joinedAtNanos();
        this.lastJoinedAtNanos = firstWaiter.joinedAtNanos();
        this.waiters = new CopyOnWriteArrayList<>(List.of(firstWaiter));
        this.done = new AtomicBoolean(false);
    }

    /**
     * Waiter 합류 (READ 중복 요청).
     *
     * @param waiter 합류할 호출자
     * @throws IllegalStateException 이미 완료된 엔트리인 경우
     */
    public void join(Waiter waiter) {
        if (done.get()) {
            throw new IllegalStateException("Cannot join completed entry: " + key);
        }
        waiters.add(waiter);
        lastJoinedAtNanos = waiter.joinedAtNanos();
    }

    /**
     * 모든 Waiter를 동일한 결과로 완료.
     *
     * @param value 결과
     * @return 이번 호출로 완료되었으면 true, 이미 완료된 경우 false
     */
    public boolean complete(OperationResult value) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }
        this.result = value;
        for (Waiter waiter : waiters) {
            waiter.completion().complete(value);
        }
        return true;
    }

    /**
     * 모든 Waiter를 동일한 예외로 실패 처리.
     *
     * @param cause 실패 원인
     * @return 이번 호출로 완료되었으면 true, 이미 완료된 경우 false
     */
    public boolean fail(Throwable cause) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }
        this.error = cause;
        for (Waiter waiter : waiters) {
            waiter.completion().completeExceptionally(cause);
        }
        return true;
    }

    public String key() {
        return key;
    }

    public Action action() {
        return action;
    }

    public OperationClass operationClass() {
        return action.operationClass();
    }

    public OperationPayload payload() {
        return payload;
    }

    public long createdAtNanos() {
        return createdAtNanos;
    }

    public long lastJoinedAtNanos() {
        return lastJoinedAtNanos;
    }

    /**
     * 현재 Waiter 스냅샷 조회.
     *
     * @return 불변 Waiter 목록 (합류 순서)
     */
    public List<Waiter> waiters() {
        return List.copyOf(waiters);
    }

    public int waiterCount() {
        return waiters.size();
    }

    public boolean isDone() {
        return done.get();
    }

    /**
     * 성공 결과 조회.
     *
     * @return 결과 (미완료 또는 실패 시 null)
     */
    public OperationResult result() {
        return result;
    }

    /**
     * 실패 원인 조회.
     *
     * @return 예외 (미완료 또는 성공 시 null)
     */
    public Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return "PendingEntry{key=" + key + ", waiters=" + waiters.size() + ", done=" + done.get() + '}';
    }
}
