package com.ryuqq.stylebatch.core.protection;

import java.time.Duration;

/**
 * 배치 단위 취소 신호.
 *
 * <p>배치 시작 시 한 번 데드라인으로 무장되며, 모든 TaskRunner가 공유합니다.
 * 한 번 발화하면 되돌릴 수 없습니다.</p>
 *
 * <p><strong>전파 지점:</strong></p>
 * <ul>
 *   <li>ConcurrencyGate 슬롯 대기</li>
 *   <li>재시도 백오프 대기</li>
 *   <li>외부 호출 (스레드 인터럽트를 통한 협조적 취소)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CancellationSignal {

    /**
     * 취소 여부 확인.
     *
     * @return 발화했으면 true
     */
    boolean isCancelled();

    /**
     * 신호 발화까지 남은 시간 조회.
     *
     * @return 남은 시간 (발화했으면 {@link Duration#ZERO})
     */
    Duration remaining();

    /**
     * 지정된 시간 동안 대기하되, 신호가 발화하면 즉시 반환.
     *
     * @param duration 대기 시간
     * @return 대기를 모두 마쳤으면 true, 신호 발화로 중단되었으면 false
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean sleep(Duration duration) throws InterruptedException;
}
