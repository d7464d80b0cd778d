package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.protection.RetryPolicy;

import java.time.Duration;

/**
 * Exponential Backoff 재시도 정책.
 *
 * <p>TRANSIENT 실패만 재시도하며, 재시도 간격을 지수적으로 증가시킵니다.
 * Jitter는 적용하지 않습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseBackoff * 2^attemptIndex, maxBackoff)
 * </pre>
 *
 * <p><strong>예시 (baseBackoff=1000ms):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: 1000ms (2^0 * base)</li>
 *   <li>attemptIndex=1: 2000ms (2^1 * base)</li>
 *   <li>attemptIndex=2: 4000ms (2^2 * base)</li>
 *   <li>attemptIndex=9: 512000ms (capped at maxBackoff=300000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: maxAttempts=3, baseBackoff=1000ms, maxBackoff=300000ms</p>
     */
    public ExponentialBackoffRetryPolicy() {
        this(3, Duration.ofSeconds(1), Duration.ofMinutes(5));
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @param baseBackoff 기본 대기 시간 (0 이상)
     * @param maxBackoff 최대 대기 시간 (baseBackoff 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException(
                "baseBackoff cannot be null or negative (current: " + baseBackoff + ")"
            );
        }
        if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException(
                "maxBackoff must be >= baseBackoff (base: " + baseBackoff + ", max: " + maxBackoff + ")"
            );
        }

        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = baseBackoff.toMillis();
        this.maxBackoffMs = maxBackoff.toMillis();
    }

    /**
     * 배치 설정으로부터 생성.
     *
     * @param config 배치 설정
     * @return 재시도 정책
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static ExponentialBackoffRetryPolicy from(BatchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new ExponentialBackoffRetryPolicy(config.maxAttempts(), config.baseBackoff(), config.maxBackoff());
    }

    @Override
    public boolean shouldRetry(GenerationError error, int attemptIndex) {
        if (error == null || !error.isTransient()) {
            return false;
        }
        return attemptIndex + 1 < maxAttempts;
    }

    @Override
    public Duration backoffFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }

        // overflow 방지: 시프트 결과가 상한을 넘으면 상한 반환
        if (attemptIndex >= Long.SIZE - 1 || baseBackoffMs > (maxBackoffMs >>> attemptIndex)) {
            return Duration.ofMillis(maxBackoffMs);
        }
        return Duration.ofMillis(baseBackoffMs << attemptIndex);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * 기본 대기 시간 조회.
     *
     * @return 기본 대기 시간
     */
    public Duration getBaseBackoff() {
        return Duration.ofMillis(baseBackoffMs);
    }

    /**
     * 최대 대기 시간 조회.
     *
     * @return 최대 대기 시간
     */
    public Duration getMaxBackoff() {
        return Duration.ofMillis(maxBackoffMs);
    }
}
