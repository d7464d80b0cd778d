package com.ryuqq.stylebatch.core.model;

/**
 * 생성 서비스 호출 1회의 성공 결과.
 *
 * @param generatedRef 생성된 이미지 참조 (예: generated_xxx.png)
 * @param analysisText 이미지와 함께 반환된 텍스트 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GenerationResult(
    String generatedRef,
    String analysisText
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException generatedRef가 null이거나 빈 문자열인 경우
     */
    public GenerationResult {
        if (generatedRef == null || generatedRef.isBlank()) {
            throw new IllegalArgumentException("generatedRef cannot be null or blank");
        }
        // analysisText는 null 허용
    }

    /**
     * 텍스트 없이 GenerationResult 생성.
     *
     * @param generatedRef 생성된 이미지 참조
     * @return GenerationResult 인스턴스
     */
    public static GenerationResult of(String generatedRef) {
        return new GenerationResult(generatedRef, null);
    }
}
