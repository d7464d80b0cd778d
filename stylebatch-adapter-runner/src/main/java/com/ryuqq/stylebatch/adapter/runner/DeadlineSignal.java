package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.core.protection.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 데드라인 기반 CancellationSignal.
 *
 * <p>생성 시점에 고정된 데드라인으로 무장되며, 데드라인이 지나거나
 * {@link #cancel()}이 호출되면 발화합니다. 발화는 되돌릴 수 없습니다.</p>
 *
 * <p>{@link #sleep(Duration)}은 데드라인과 명시적 취소 모두에 즉시 반응하므로
 * 별도의 타이머 스레드가 필요 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeadlineSignal implements CancellationSignal {

    private final long deadlineNanos;
    private final CountDownLatch fired = new CountDownLatch(1);

    private DeadlineSignal(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 현재 시각부터 timeout 후에 발화하는 신호 생성.
     *
     * @param timeout 데드라인까지 시간 (0 이상)
     * @return DeadlineSignal 인스턴스
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public static DeadlineSignal startingNow(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        return new DeadlineSignal(System.nanoTime() + timeout.toNanos());
    }

    /**
     * 신호 즉시 발화.
     *
     * <p>여러 번 호출해도 안전합니다.</p>
     */
    public void cancel() {
        fired.countDown();
    }

    @Override
    public boolean isCancelled() {
        return fired.getCount() == 0 || System.nanoTime() - deadlineNanos >= 0;
    }

    @Override
    public Duration remaining() {
        if (fired.getCount() == 0) {
            return Duration.ZERO;
        }
        long remainingNanos = deadlineNanos - System.nanoTime();
        return remainingNanos > 0 ? Duration.ofNanos(remainingNanos) : Duration.ZERO;
    }

    @Override
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative (current: " + duration + ")");
        }
        if (isCancelled()) {
            return false;
        }

        long waitNanos = Math.min(duration.toNanos(), remaining().toNanos());
        if (fired.await(waitNanos, TimeUnit.NANOSECONDS)) {
            return false;
        }
        return !isCancelled();
    }
}
