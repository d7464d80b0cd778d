package com.ryuqq.stylebatch.core.model;

import java.time.Duration;

/**
 * 스타일 하나의 최종 처리 결과.
 *
 * <p>TaskRunner가 종료될 때(성공, 재시도 소진, 취소) 정확히 한 번 생성되며,
 * 데드라인 초과 시에는 Orchestrator가 합성합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>success == true: generatedRef 필수, error는 null</li>
 *   <li>success == false: error 필수, generatedRef는 null</li>
 *   <li>attempts: 실제 생성 서비스 호출 횟수 (슬롯을 얻지 못했다면 0)</li>
 * </ul>
 *
 * @param styleId 스타일 ID
 * @param styleName 스타일 표시 이름
 * @param success 성공 여부
 * @param generatedRef 생성된 이미지 참조 (실패 시 null)
 * @param analysisText 생성 서비스가 함께 반환한 텍스트 (null 가능)
 * @param error 마지막 오류 설명 (성공 시 null)
 * @param elapsed 작업 시작부터 종료까지 경과 시간 (재시도 및 백오프 포함)
 * @param attempts 생성 서비스 호출 횟수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskOutcome(
    String styleId,
    String styleName,
    boolean success,
    String generatedRef,
    String analysisText,
    String error,
    Duration elapsed,
    int attempts
) {

    /**
     * 취소된 작업의 오류 값.
     */
    public static final String CANCELLED = "cancelled";

    /**
     * 데드라인까지 결과를 내지 못한 작업의 오류 값.
     */
    public static final String DEADLINE_EXCEEDED = "deadline exceeded";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public TaskOutcome {
        if (styleId == null || styleId.isBlank()) {
            throw new IllegalArgumentException("styleId cannot be null or blank");
        }
        if (styleName == null || styleName.isBlank()) {
            throw new IllegalArgumentException("styleName cannot be null or blank");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed cannot be null or negative (current: " + elapsed + ")");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        if (success) {
            if (generatedRef == null || generatedRef.isBlank()) {
                throw new IllegalArgumentException("generatedRef is required for a successful outcome");
            }
            if (error != null) {
                throw new IllegalArgumentException("error must be null for a successful outcome");
            }
        } else {
            if (error == null || error.isBlank()) {
                throw new IllegalArgumentException("error is required for a failed outcome");
            }
            if (generatedRef != null) {
                throw new IllegalArgumentException("generatedRef must be null for a failed outcome");
            }
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param style 스타일
     * @param result 생성 결과
     * @param elapsed 경과 시간
     * @param attempts 호출 횟수
     * @return 성공 TaskOutcome
     */
    public static TaskOutcome succeeded(StyleDescriptor style, GenerationResult result, Duration elapsed, int attempts) {
        return new TaskOutcome(style.id(), style.name(), true,
            result.generatedRef(), result.analysisText(), null, elapsed, attempts);
    }

    /**
     * 실패 결과 생성.
     *
     * @param style 스타일
     * @param error 오류 설명
     * @param elapsed 경과 시간
     * @param attempts 호출 횟수
     * @return 실패 TaskOutcome
     */
    public static TaskOutcome failed(StyleDescriptor style, String error, Duration elapsed, int attempts) {
        return new TaskOutcome(style.id(), style.name(), false, null, null, error, elapsed, attempts);
    }

    /**
     * 취소 결과 생성 (슬롯 대기 또는 백오프 중 취소).
     *
     * @param style 스타일
     * @param elapsed 경과 시간
     * @param attempts 호출 횟수
     * @return 취소 TaskOutcome
     */
    public static TaskOutcome cancelled(StyleDescriptor style, Duration elapsed, int attempts) {
        return failed(style, CANCELLED, elapsed, attempts);
    }

    /**
     * 데드라인 초과 결과 합성.
     *
     * <p>유예 시간 내에 결과를 내지 못한 작업에 대해 Orchestrator가 생성합니다.
     * 호출 횟수는 알 수 없으므로 0으로 기록합니다.</p>
     *
     * @param style 스타일
     * @param elapsed 배치 시작부터 합성 시점까지 경과 시간
     * @return 데드라인 초과 TaskOutcome
     */
    public static TaskOutcome deadlineExceeded(StyleDescriptor style, Duration elapsed) {
        return deadlineExceeded(style, elapsed, 0);
    }

    /**
     * 데드라인 초과 결과 생성 (호출 횟수 유지).
     *
     * <p>데드라인 발화로 취소된 작업의 결과를 데드라인 초과로 기록할 때 사용합니다.</p>
     *
     * @param style 스타일
     * @param elapsed 경과 시간
     * @param attempts 호출 횟수
     * @return 데드라인 초과 TaskOutcome
     */
    public static TaskOutcome deadlineExceeded(StyleDescriptor style, Duration elapsed, int attempts) {
        return failed(style, DEADLINE_EXCEEDED, elapsed, attempts);
    }

    /**
     * 데드라인 초과로 합성된 결과인지 확인.
     *
     * @return 데드라인 초과 여부
     */
    public boolean isDeadlineExceeded() {
        return !success && DEADLINE_EXCEEDED.equals(error);
    }

    /**
     * 취소된 결과인지 확인.
     *
     * @return 취소 여부
     */
    public boolean isCancelled() {
        return !success && CANCELLED.equals(error);
    }
}
