package com.ryuqq.stylebatch.core.protection;

/**
 * 동시 외부 호출 수 제한 SPI.
 *
 * <p>외부 생성 서비스의 Rate Limit을 지키기 위해 동시에 진행 중인 호출 수를
 * {@code maxConcurrent} 이하로 제한합니다. 슬롯은 외부 호출 1회를 나타내며,
 * 호출이 반환되는 즉시 해제되어야 합니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>FIFO 이상의 공정성 (유한한 N에서 기아 없음)</li>
 *   <li>슬롯 카운터는 원자적으로 변경됨</li>
 *   <li>대기는 취소 신호 또는 인터럽트로 즉시 중단 가능</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!gate.acquire(signal)) {
 *     return TaskOutcome.cancelled(style, elapsed, attempts);
 * }
 * try {
 *     result = client.generate(style, artifact);
 * } finally {
 *     gate.release();
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConcurrencyGate {

    /**
     * 슬롯 획득 (취소 가능한 대기).
     *
     * @param signal 배치 취소 신호
     * @return true: 슬롯 획득, false: 신호 발화로 대기 중단
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean acquire(CancellationSignal signal) throws InterruptedException;

    /**
     * 슬롯 반환.
     *
     * <p>반드시 try-finally 블록에서 호출되어야 합니다.</p>
     *
     * @throws IllegalStateException 획득한 슬롯이 없는데 호출한 경우
     */
    void release();

    /**
     * 현재 점유 중인 슬롯 수 조회.
     *
     * @return 진행 중인 외부 호출 수
     */
    int activeCount();

    /**
     * 최대 동시 호출 수 조회.
     *
     * @return maxConcurrent
     */
    int maxConcurrent();
}
