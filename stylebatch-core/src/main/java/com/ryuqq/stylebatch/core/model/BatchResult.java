package com.ryuqq.stylebatch.core.model;

import java.time.Duration;
import java.util.List;

/**
 * 배치 전체 결과.
 *
 * <p>HTTP 계층이 그대로 응답으로 변환할 수 있는 형태입니다.
 * 일부 스타일이 실패하거나 데드라인이 초과되어도 항상 생성됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>total == outcomes.size()</li>
 *   <li>succeeded + failed == total</li>
 *   <li>succeeded == 성공 outcome 수</li>
 *   <li>outcomes 순서 == 카탈로그 순서 (완료 순서와 무관)</li>
 * </ul>
 *
 * @param originalRef 원본 이미지 참조
 * @param totalElapsed 배치 시작부터 종료까지 경과 시간
 * @param total 전체 스타일 수
 * @param succeeded 성공 수
 * @param failed 실패 수
 * @param outcomes 스타일별 결과 (카탈로그 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BatchResult(
    String originalRef,
    Duration totalElapsed,
    int total,
    int succeeded,
    int failed,
    List<TaskOutcome> outcomes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public BatchResult {
        if (originalRef == null || originalRef.isBlank()) {
            throw new IllegalArgumentException("originalRef cannot be null or blank");
        }
        if (totalElapsed == null || totalElapsed.isNegative()) {
            throw new IllegalArgumentException("totalElapsed cannot be null or negative (current: " + totalElapsed + ")");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        outcomes = List.copyOf(outcomes);
        if (total != outcomes.size()) {
            throw new IllegalArgumentException(
                "total must equal outcomes size (total: " + total + ", outcomes: " + outcomes.size() + ")"
            );
        }
        if (succeeded + failed != total) {
            throw new IllegalArgumentException(
                "succeeded + failed must equal total (succeeded: " + succeeded + ", failed: " + failed + ", total: " + total + ")"
            );
        }
        long actualSucceeded = outcomes.stream().filter(TaskOutcome::success).count();
        if (actualSucceeded != succeeded) {
            throw new IllegalArgumentException(
                "succeeded does not match outcomes (succeeded: " + succeeded + ", actual: " + actualSucceeded + ")"
            );
        }
    }

    /**
     * outcomes로부터 집계값을 계산하여 BatchResult 생성.
     *
     * @param originalRef 원본 이미지 참조
     * @param totalElapsed 전체 경과 시간
     * @param outcomes 스타일별 결과 (카탈로그 순서)
     * @return BatchResult 인스턴스
     */
    public static BatchResult of(String originalRef, Duration totalElapsed, List<TaskOutcome> outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        int succeeded = (int) outcomes.stream().filter(TaskOutcome::success).count();
        return new BatchResult(originalRef, totalElapsed, outcomes.size(), succeeded, outcomes.size() - succeeded, outcomes);
    }

    /**
     * 데드라인 초과로 합성된 outcome 수 조회.
     *
     * <p>"시간 초과로 일부만 완료"와 "완료했지만 일부 실패"를 구분하는 데 사용합니다.</p>
     *
     * @return 데드라인 초과 outcome 수
     */
    public int deadlineExceededCount() {
        return (int) outcomes.stream().filter(TaskOutcome::isDeadlineExceeded).count();
    }

    /**
     * 성공한 스타일이 하나라도 있는지 확인.
     *
     * <p>false인 경우 호출자는 업로드된 원본 정리를 고려할 수 있습니다.</p>
     *
     * @return 성공 존재 여부
     */
    public boolean hasAnySuccess() {
        return succeeded > 0;
    }

    /**
     * 전체 경과 시간이 데드라인에 도달했는지 확인.
     *
     * @param deadline 설정된 데드라인
     * @return totalElapsed &gt;= deadline 인 경우 true
     */
    public boolean exceeded(Duration deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        return totalElapsed.compareTo(deadline) >= 0;
    }
}
