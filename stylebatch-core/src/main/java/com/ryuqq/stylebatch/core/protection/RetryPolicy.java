package com.ryuqq.stylebatch.core.protection;

import com.ryuqq.stylebatch.core.failure.GenerationError;

import java.time.Duration;

/**
 * 재시도 정책 SPI.
 *
 * <p>오류와 시도 인덱스만으로 재시도 여부와 대기 시간을 결정하는 순수 함수입니다.
 * 시도 인덱스는 0부터 시작합니다 (첫 호출 = 0).</p>
 *
 * <p><strong>기본 정책:</strong></p>
 * <ul>
 *   <li>TRANSIENT 실패만 재시도</li>
 *   <li>최대 시도 횟수 3 (첫 시도 + 재시도 2회)</li>
 *   <li>지수 백오프: base * 2^attempt (1s, 2s, 4s, ...)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 재시도 여부 결정.
     *
     * @param error 방금 실패한 시도의 오류
     * @param attemptIndex 방금 실패한 시도의 인덱스 (0부터)
     * @return 재시도해야 하면 true
     */
    boolean shouldRetry(GenerationError error, int attemptIndex);

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attemptIndex 방금 실패한 시도의 인덱스 (0부터)
     * @return 대기 시간
     * @throws IllegalArgumentException attemptIndex가 음수인 경우
     */
    Duration backoffFor(int attemptIndex);

    /**
     * 최대 시도 횟수 조회.
     *
     * @return 최대 시도 횟수 (1 이상)
     */
    int maxAttempts();
}
