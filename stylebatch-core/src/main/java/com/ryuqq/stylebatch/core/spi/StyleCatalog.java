package com.ryuqq.stylebatch.core.spi;

import com.ryuqq.stylebatch.core.model.StyleDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * 스타일 카탈로그 SPI.
 *
 * <p>처리할 스타일의 고정된 순서 목록을 제공합니다. 크기와 내용은 설정이 소유하며,
 * Orchestrator는 읽기만 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StyleCatalog {

    /**
     * 스타일 목록 조회 (카탈로그 순서).
     *
     * @return 불변 스타일 목록 (ID 고유)
     */
    List<StyleDescriptor> styles();

    /**
     * ID로 스타일 조회.
     *
     * @param id 스타일 ID
     * @return 스타일 (없으면 empty)
     */
    default Optional<StyleDescriptor> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return styles().stream()
            .filter(style -> style.id().equals(id))
            .findFirst();
    }
}
