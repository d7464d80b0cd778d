package com.ryuqq.stylebatch.application.orchestrator;

import java.time.Duration;

/**
 * 배치 실행 설정 (불변 record).
 *
 * <p>배치 하나가 실행되는 동안 고정되며, 실행 중 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 동시 외부 호출 수 (기본 5)</li>
 *   <li>maxAttempts: 스타일당 최대 시도 횟수 (기본 3 = 첫 시도 + 재시도 2회)</li>
 *   <li>deadline: 배치 전체 데드라인 (기본 60초)</li>
 *   <li>baseBackoff: 첫 재시도 전 대기 시간 (기본 1초, 이후 2배씩 증가)</li>
 *   <li>maxBackoff: 백오프 상한 (기본 5분)</li>
 *   <li>gracePeriod: 데드라인 이후 취소된 작업의 결과를 기다리는 시간 (기본 500ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>429가 잦음: maxConcurrent 감소 (5 → 2), baseBackoff 증가</li>
 *   <li>느린 모델: deadline 증가 (60s → 120s)</li>
 *   <li>빠른 응답 우선: maxAttempts 감소 (3 → 1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrent 동시 외부 호출 수 (1 이상이어야 함)
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param deadline 배치 데드라인 (양수여야 함)
 * @param baseBackoff 기본 백오프 (0 이상이어야 함)
 * @param maxBackoff 백오프 상한 (baseBackoff 이상이어야 함)
 * @param gracePeriod 취소 후 유예 시간 (0 이상이어야 함)
 */
public record BatchConfig(
    int maxConcurrent,
    int maxAttempts,
    Duration deadline,
    Duration baseBackoff,
    Duration maxBackoff,
    Duration gracePeriod
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrent=5, maxAttempts=3, deadline=60s,
     * baseBackoff=1s, maxBackoff=5m, gracePeriod=500ms</p>
     */
    public BatchConfig() {
        this(5, 3, Duration.ofSeconds(60), Duration.ofSeconds(1), Duration.ofMinutes(5), Duration.ofMillis(500));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException(
                "deadline must be positive (current: " + deadline + ")"
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
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new IllegalArgumentException(
                "gracePeriod cannot be null or negative (current: " + gracePeriod + ")"
            );
        }
    }

    /**
     * maxConcurrent만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxConcurrent(int maxConcurrent) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxAttempts(int maxAttempts) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }

    /**
     * deadline만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withDeadline(Duration deadline) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }

    /**
     * baseBackoff만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withBaseBackoff(Duration baseBackoff) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }

    /**
     * maxBackoff만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxBackoff(Duration maxBackoff) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }

    /**
     * gracePeriod만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withGracePeriod(Duration gracePeriod) {
        return new BatchConfig(maxConcurrent, maxAttempts, deadline, baseBackoff, maxBackoff, gracePeriod);
    }
}
