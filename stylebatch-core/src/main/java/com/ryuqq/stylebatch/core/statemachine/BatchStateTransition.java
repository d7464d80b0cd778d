package com.ryuqq.stylebatch.core.statemachine;

/**
 * 배치 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RUNNING → ALL_COMPLETED</li>
 *   <li>RUNNING → DEADLINE_EXCEEDED</li>
 *   <li>ALL_COMPLETED → FINALIZED</li>
 *   <li>DEADLINE_EXCEEDED → FINALIZED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchStateTransition {

    // Utility class - prevent instantiation
    private BatchStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(BatchState from, BatchState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case RUNNING -> to == BatchState.ALL_COMPLETED || to == BatchState.DEADLINE_EXCEEDED;
            case ALL_COMPLETED, DEADLINE_EXCEEDED -> to == BatchState.FINALIZED;
            case FINALIZED -> false; // 종료 상태 (위에서 이미 체크했지만 명시적 표현)
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static BatchState transition(BatchState current, BatchState next) {
        validate(current, next);
        return next;
    }
}
