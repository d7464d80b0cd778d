package com.ryuqq.stylebatch.core.failure;

/**
 * GenerationClient가 실패를 알리는 예외.
 *
 * <p>분류된 {@link GenerationError}를 함께 전달하여 TaskRunner가
 * 메시지 해석 없이 재시도 여부를 결정할 수 있도록 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GenerationException extends RuntimeException {

    private final GenerationError error;

    /**
     * 생성자.
     *
     * @param error 분류된 오류
     * @throws IllegalArgumentException error가 null인 경우
     */
    public GenerationException(GenerationError error) {
        this(error, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param error 분류된 오류
     * @param cause 원인 예외 (null 허용)
     * @throws IllegalArgumentException error가 null인 경우
     */
    public GenerationException(GenerationError error, Throwable cause) {
        super(requireError(error).message(), cause);
        this.error = error;
    }

    /**
     * 일시적 실패 예외 생성.
     *
     * @param message 오류 설명
     * @return GenerationException
     */
    public static GenerationException transientFailure(String message) {
        return new GenerationException(GenerationError.transientError(message));
    }

    /**
     * 영구적 실패 예외 생성.
     *
     * @param message 오류 설명
     * @return GenerationException
     */
    public static GenerationException permanentFailure(String message) {
        return new GenerationException(GenerationError.permanent(message));
    }

    /**
     * 분류된 오류 조회.
     *
     * @return GenerationError
     */
    public GenerationError getError() {
        return error;
    }

    private static GenerationError requireError(GenerationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }
}
