package com.ryuqq.stylebatch.adapter.inmemory;

import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.spi.ArtifactCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ArtifactCleaner} SPI.
 *
 * <p>실제 파일을 삭제하지 않고 폐기 요청된 원본을 기록합니다.
 * 테스트 및 참조 구현용입니다.</p>
 *
 * <p><strong>Thread Safety:</strong> {@link CopyOnWriteArrayList}로 기록을 보관합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryArtifactCleaner implements ArtifactCleaner {

    private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactCleaner.class);

    private final List<SourceArtifact> discarded = new CopyOnWriteArrayList<>();

    @Override
    public void discard(SourceArtifact artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        discarded.add(artifact);
        log.debug("Discarded {}", artifact);
    }

    /**
     * 폐기된 원본 목록 조회.
     *
     * @return 폐기 순서대로 정렬된 불변 목록
     */
    public List<SourceArtifact> getDiscarded() {
        return List.copyOf(discarded);
    }

    /**
     * 특정 원본의 폐기 여부 확인.
     *
     * @param artifact 확인할 원본
     * @return 폐기되었으면 true
     */
    public boolean isDiscarded(SourceArtifact artifact) {
        return discarded.contains(artifact);
    }

    /**
     * 기록 초기화 (테스트용).
     */
    public void clear() {
        discarded.clear();
    }
}
