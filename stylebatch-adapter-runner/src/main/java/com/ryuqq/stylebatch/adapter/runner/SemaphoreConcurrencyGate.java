package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.core.protection.CancellationSignal;
import com.ryuqq.stylebatch.core.protection.ConcurrencyGate;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semaphore 기반 ConcurrencyGate.
 *
 * <p>공정(fair) Semaphore를 사용하여 대기 순서대로 슬롯을 부여합니다.
 * 대기 시간은 취소 신호의 남은 시간으로 제한되며, 인터럽트로도 즉시 중단됩니다.</p>
 *
 * <p>배치마다 새 인스턴스를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SemaphoreConcurrencyGate implements ConcurrencyGate {

    private final int maxConcurrent;
    private final Semaphore permits;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param maxConcurrent 최대 동시 호출 수 (1 이상)
     * @throws IllegalArgumentException maxConcurrent가 양수가 아닌 경우
     */
    public SemaphoreConcurrencyGate(int maxConcurrent) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    @Override
    public boolean acquire(CancellationSignal signal) throws InterruptedException {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (signal.isCancelled()) {
            return false;
        }

        if (!permits.tryAcquire(signal.remaining().toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }

        // 대기 직후 신호가 발화했다면 호출하지 않고 슬롯 반환
        if (signal.isCancelled()) {
            permits.release();
            return false;
        }

        int current = active.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
        return true;
    }

    @Override
    public void release() {
        int previous = active.getAndUpdate(value -> value > 0 ? value - 1 : value);
        if (previous == 0) {
            throw new IllegalStateException("release() called without an acquired slot");
        }
        permits.release();
    }

    @Override
    public int activeCount() {
        return active.get();
    }

    @Override
    public int maxConcurrent() {
        return maxConcurrent;
    }

    /**
     * 지금까지 관측된 최대 동시 점유 수 조회.
     *
     * @return 최대 동시 점유 수
     */
    public int peakCount() {
        return peak.get();
    }
}
