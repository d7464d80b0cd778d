package com.ryuqq.stylebatch.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 업로드된 원본 이미지 핸들.
 *
 * <p>Orchestrator에게는 불투명한 값이며, 배치가 끝나거나 포기될 때까지
 * 호출자가 읽기 가능한 상태로 유지해야 합니다. 모든 작업이 읽기만 하므로
 * 동기화 없이 공유됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SourceArtifact {

    private final String ref;
    private final Path location;

    private SourceArtifact(String ref, Path location) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("ref cannot be null or blank");
        }
        this.ref = ref;
        this.location = location;
    }

    /**
     * 파일 경로로 SourceArtifact 생성.
     *
     * <p>ref는 경로의 파일명으로 설정됩니다.</p>
     *
     * @param location 원본 이미지 경로
     * @return SourceArtifact 인스턴스
     * @throws IllegalArgumentException location이 null이거나 파일명이 없는 경우
     */
    public static SourceArtifact of(Path location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        Path fileName = location.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("location must point to a file (current: " + location + ")");
        }
        return new SourceArtifact(fileName.toString(), location);
    }

    /**
     * 참조 이름과 경로로 SourceArtifact 생성.
     *
     * @param ref 호출자에게 노출되는 참조 이름
     * @param location 원본 이미지 경로 (null 허용, 메모리 기반 원본)
     * @return SourceArtifact 인스턴스
     * @throws IllegalArgumentException ref가 null이거나 빈 문자열인 경우
     */
    public static SourceArtifact of(String ref, Path location) {
        return new SourceArtifact(ref, location);
    }

    /**
     * 참조 이름 조회.
     *
     * @return 참조 이름 (BatchResult.originalRef로 반환됨)
     */
    public String getRef() {
        return ref;
    }

    /**
     * 원본 경로 조회.
     *
     * @return 원본 경로 (메모리 기반 원본이면 null)
     */
    public Path getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceArtifact that = (SourceArtifact) o;
        return ref.equals(that.ref) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, location);
    }

    @Override
    public String toString() {
        return "SourceArtifact{" + ref + '}';
    }
}
