package com.ryuqq.stylebatch.core.statemachine;

/**
 * 배치 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING
 *    │
 *    ├─► ALL_COMPLETED (모든 작업이 데드라인 내 완료)
 *    │        │
 *    └─► DEADLINE_EXCEEDED (데드라인 발화)
 *             │
 *             ▼
 *         FINALIZED (BatchResult 조립 완료)
 * </pre>
 *
 * <p>배치 수준 재시도는 없습니다. 재시도는 각 TaskRunner 내부에서만 일어납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BatchState {

    /**
     * 작업 실행 중.
     */
    RUNNING,

    /**
     * 모든 작업 완료.
     */
    ALL_COMPLETED,

    /**
     * 데드라인 초과 (미완료 작업 취소됨).
     */
    DEADLINE_EXCEEDED,

    /**
     * 결과 조립 완료.
     */
    FINALIZED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FINALIZED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINALIZED;
    }
}
