package com.ryuqq.stylebatch.core.protection.noop;

import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.protection.RetryPolicy;

import java.time.Duration;

/**
 * 재시도하지 않는 RetryPolicy.
 *
 * <p>모든 실패를 첫 시도에서 확정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoRetryPolicy implements RetryPolicy {

    @Override
    public boolean shouldRetry(GenerationError error, int attemptIndex) {
        return false;
    }

    @Override
    public Duration backoffFor(int attemptIndex) {
        return Duration.ZERO;
    }

    @Override
    public int maxAttempts() {
        return 1;
    }
}
