package com.ryuqq.stylebatch.core.failure;

/**
 * 생성 서비스 호출 1회의 실패.
 *
 * @param failureClass 실패 분류
 * @param message 오류 설명 (TaskOutcome.error로 전달됨)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GenerationError(
    FailureClass failureClass,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failureClass가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public GenerationError {
        if (failureClass == null) {
            throw new IllegalArgumentException("failureClass cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 일시적 실패 생성.
     *
     * @param message 오류 설명
     * @return TRANSIENT GenerationError
     */
    public static GenerationError transientError(String message) {
        return new GenerationError(FailureClass.TRANSIENT, message);
    }

    /**
     * 영구적 실패 생성.
     *
     * @param message 오류 설명
     * @return PERMANENT GenerationError
     */
    public static GenerationError permanent(String message) {
        return new GenerationError(FailureClass.PERMANENT, message);
    }

    /**
     * 예외를 휴리스틱으로 분류하여 GenerationError 생성.
     *
     * <p>구조화된 오류 코드를 제공하지 않는 클라이언트 경계에서만 사용합니다.</p>
     *
     * @param throwable 원인 예외
     * @return 분류된 GenerationError
     * @see FailureClassifier#classify(Throwable)
     */
    public static GenerationError from(Throwable throwable) {
        return new GenerationError(FailureClassifier.classify(throwable), FailureClassifier.describe(throwable));
    }

    /**
     * 재시도 가능한 실패인지 확인.
     *
     * @return TRANSIENT인 경우 true
     */
    public boolean isTransient() {
        return failureClass.isRetryable();
    }
}
