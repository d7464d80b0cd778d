package com.ryuqq.stylebatch.adapter.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeadlineSignal 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeadlineSignalTest {

    @Test
    @DisplayName("데드라인 전에는 취소되지 않고 남은 시간이 양수")
    void 데드라인_전() {
        // when
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofSeconds(10));

        // then
        assertThat(signal.isCancelled()).isFalse();
        assertThat(signal.remaining()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("데드라인이 지나면 취소 상태")
    void 데드라인_경과() throws InterruptedException {
        // given
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofMillis(30));

        // when
        Thread.sleep(60);

        // then
        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("cancel() 호출 즉시 취소 상태")
    void 명시적_취소() {
        // given
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofSeconds(10));

        // when
        signal.cancel();

        // then
        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("sleep은 지정 시간만큼 대기 후 true")
    void sleep_완료() throws InterruptedException {
        // given
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofSeconds(10));
        long start = System.nanoTime();

        // when
        boolean completed = signal.sleep(Duration.ofMillis(50));

        // then
        assertThat(completed).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(50));
    }

    @Test
    @DisplayName("sleep 도중 cancel()되면 즉시 false")
    void sleep_취소() throws Exception {
        // given
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofSeconds(30));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        long start = System.nanoTime();

        try {
            // when
            Future<Boolean> sleeping = executor.submit(() -> signal.sleep(Duration.ofSeconds(10)));
            Thread.sleep(50);
            signal.cancel();

            // then
            assertThat(sleeping.get(2, TimeUnit.SECONDS)).isFalse();
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("데드라인보다 긴 sleep은 데드라인에서 false")
    void sleep_데드라인_초과() throws InterruptedException {
        // given
        DeadlineSignal signal = DeadlineSignal.startingNow(Duration.ofMillis(50));

        // when
        boolean completed = signal.sleep(Duration.ofSeconds(10));

        // then
        assertThat(completed).isFalse();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("음수 시간은 예외")
    void 음수_시간_예외() {
        assertThatThrownBy(() -> DeadlineSignal.startingNow(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DeadlineSignal.startingNow(Duration.ofSeconds(1)).sleep(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
