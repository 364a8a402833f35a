package com.ryuqq.batchqueue.adapter.runner;

import com.ryuqq.batchqueue.core.spi.BatchTimer.TimerHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScheduledBatchTimer 테스트 (실제 시간 사용).
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
class ScheduledBatchTimerTest {

    private final ScheduledBatchTimer timer = new ScheduledBatchTimer(2);

    @AfterEach
    void tearDown() {
        timer.close();
    }

    @Test
    void 지연_후_이름_붙은_타이머_스레드에서_실행됨() throws Exception {
        // given
        CompletableFuture<String> threadName = new CompletableFuture<>();

        // when
        timer.schedule(() -> threadName.complete(Thread.currentThread().getName()), 10);

        // then
        assertThat(threadName.get(5, TimeUnit.SECONDS)).startsWith("batchqueue-timer-");
    }

    @Test
    void 긴_작업이_실행_중이어도_다른_작업이_실행됨() throws Exception {
        // given
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch secondRan = new CountDownLatch(1);
        timer.schedule(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 0);

        // when
        timer.schedule(secondRan::countDown, 10);

        // then
        assertThat(secondRan.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    void 취소된_작업은_실행되지_않음() throws Exception {
        // given
        AtomicBoolean ran = new AtomicBoolean();
        TimerHandle handle = timer.schedule(() -> ran.set(true), 200);

        // when
        boolean cancelled = handle.cancel();
        Thread.sleep(300);

        // then
        assertThat(cancelled).isTrue();
        assertThat(ran).isFalse();
    }

    @Test
    void close_후에는_종료_상태() {
        // when
        timer.close();

        // then
        assertThat(timer.isShutdown()).isTrue();
    }

    @Test
    void 스레드가_2개_미만이면_예외() {
        assertThatThrownBy(() -> new ScheduledBatchTimer(1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
