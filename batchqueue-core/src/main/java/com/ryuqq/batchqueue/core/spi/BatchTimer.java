package com.ryuqq.batchqueue.core.spi;

/**
 * 스케줄러가 사용하는 타이머/시계 추상화.
 *
 * <p>실서비스는 {@code ScheduledExecutorService} 기반 구현을, 테스트는 가상 시간 구현을 주입하여
 * 실제 sleep 없이 배치 타이밍을 결정적으로 검증합니다.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public interface BatchTimer {

    /**
     * delayMs 이후 task를 한 번 실행하도록 예약.
     *
     * @param task 실행할 작업
     * @param delayMs 지연 (밀리초, 0 이상)
     * @return 취소 핸들
     * @throws IllegalArgumentException task가 null이거나 delayMs가 음수인 경우
     */
    TimerHandle schedule(Runnable task, long delayMs);

    /**
     * monotonic 시계 조회 (관측 용도).
     *
     * @return 나노초
     */
    long nanoTime();

    /**
     * 예약된 작업의 핸들.
     */
    interface TimerHandle {

        /**
         * 아직 실행되지 않은 작업 취소.
         *
         * @return 취소되었으면 true, 이미 실행되었거나 취소된 경우 false
         */
        boolean cancel();
    }
}
