package com.ryuqq.stylebatch.core.spi;

import com.ryuqq.stylebatch.core.model.SourceArtifact;

/**
 * 원본 이미지 정리 SPI.
 *
 * <p>배치가 단 하나의 결과도 만들지 못했을 때 업로드된 원본을 정리합니다.
 * Orchestrator는 호출하지 않으며, 결과를 관찰한 상위 계층이 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ArtifactCleaner {

    /**
     * 원본 이미지 폐기.
     *
     * @param artifact 폐기할 원본
     */
    void discard(SourceArtifact artifact);
}
