package com.ryuqq.stylebatch.core.model;

/**
 * 변환 스타일 정의.
 *
 * <p>스타일 카탈로그의 항목 하나를 나타내며, 배치 실행 동안 읽기 전용으로 공유됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id: null 또는 빈 문자열 불가 (카탈로그 내에서 고유)</li>
 *   <li>name: null 또는 빈 문자열 불가</li>
 *   <li>description: null 불가 (빈 문자열 허용)</li>
 * </ul>
 *
 * @param id 스타일 ID (예: minimalist)
 * @param name 표시 이름 (예: 미니멀리스트)
 * @param description 스타일 설명 (생성 요청에 함께 전달)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StyleDescriptor(
    String id,
    String name,
    String description
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public StyleDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
    }

    /**
     * StyleDescriptor 생성.
     *
     * @param id 스타일 ID
     * @param name 표시 이름
     * @param description 스타일 설명
     * @return StyleDescriptor 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StyleDescriptor of(String id, String name, String description) {
        return new StyleDescriptor(id, name, description);
    }
}
