package com.ryuqq.stylebatch.application.service;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.spi.ArtifactCleaner;
import com.ryuqq.stylebatch.core.spi.StyleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 스타일 변환 유스케이스.
 *
 * <p>HTTP 계층이 호출하는 진입점으로, 카탈로그 조회와 배치 실행,
 * 전체 실패 시 원본 정리를 묶습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>스타일 목록 제공</li>
 *   <li>전체 카탈로그 배치 실행</li>
 *   <li>단일 스타일 실행 (스타일 ID 검증 포함)</li>
 *   <li>성공 결과가 하나도 없으면 {@link ArtifactCleaner}로 원본 폐기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StyleTransformService {

    private static final Logger log = LoggerFactory.getLogger(StyleTransformService.class);

    private final BatchOrchestrator orchestrator;
    private final StyleCatalog catalog;
    private final ArtifactCleaner cleaner;
    private final BatchConfig config;

    /**
     * 생성자.
     *
     * @param orchestrator 배치 실행 조정자
     * @param catalog 스타일 카탈로그
     * @param cleaner 원본 정리기
     * @param config 배치 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StyleTransformService(BatchOrchestrator orchestrator, StyleCatalog catalog,
                                 ArtifactCleaner cleaner, BatchConfig config) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (cleaner == null) {
            throw new IllegalArgumentException("cleaner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.orchestrator = orchestrator;
        this.catalog = catalog;
        this.cleaner = cleaner;
        this.config = config;
    }

    /**
     * 사용 가능한 스타일 목록 조회.
     *
     * @return 카탈로그 순서의 스타일 목록
     */
    public List<StyleDescriptor> styles() {
        return catalog.styles();
    }

    /**
     * 카탈로그의 모든 스타일로 변환.
     *
     * @param artifact 원본 이미지
     * @return 배치 결과
     * @throws IllegalArgumentException artifact가 null이거나 카탈로그가 비어 있는 경우
     */
    public BatchResult transformAll(SourceArtifact artifact) {
        return runAndCleanUp(artifact, catalog.styles());
    }

    /**
     * 단일 스타일로 변환.
     *
     * @param artifact 원본 이미지
     * @param styleId 스타일 ID
     * @return 스타일 하나짜리 배치 결과
     * @throws IllegalArgumentException 스타일 ID가 카탈로그에 없는 경우
     */
    public BatchResult transform(SourceArtifact artifact, String styleId) {
        StyleDescriptor style = catalog.findById(styleId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown style id: " + styleId));
        return runAndCleanUp(artifact, List.of(style));
    }

    /**
     * 배치 실행 후 성공이 없으면 원본 정리.
     *
     * <p>정리 실패는 기록만 하고 결과 반환을 막지 않습니다.</p>
     */
    private BatchResult runAndCleanUp(SourceArtifact artifact, List<StyleDescriptor> styles) {
        BatchResult result = orchestrator.runBatch(artifact, styles, config);

        if (!result.hasAnySuccess()) {
            log.warn("No style succeeded for {} ({} failed, {} timed out), discarding source",
                artifact, result.failed(), result.deadlineExceededCount());
            try {
                cleaner.discard(artifact);
            } catch (RuntimeException e) {
                log.error("Failed to discard source {}", artifact, e);
            }
        }
        return result;
    }
}
