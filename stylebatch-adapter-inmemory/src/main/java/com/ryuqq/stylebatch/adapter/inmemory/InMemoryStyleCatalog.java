package com.ryuqq.stylebatch.adapter.inmemory;

import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.spi.StyleCatalog;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory implementation of {@link StyleCatalog} SPI.
 *
 * <p>생성 시점에 고정된 스타일 목록을 보관합니다. 목록 순서가 곧 카탈로그 순서이며,
 * 배치 결과의 outcome 순서도 이 순서를 따릅니다.</p>
 *
 * <p><strong>기본 카탈로그:</strong> {@link #defaults()}는 다섯 가지 인테리어 스타일
 * (minimalist, scandinavian, modern, vintage, industrial)을 제공합니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 불변 객체로 동시 접근에 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryStyleCatalog implements StyleCatalog {

    private static final List<StyleDescriptor> DEFAULT_STYLES = List.of(
        StyleDescriptor.of("minimalist", "미니멀리스트",
            "깔끔하고 단순한 디자인. 필수적인 가구만 배치하고 여백을 강조합니다."),
        StyleDescriptor.of("scandinavian", "스칸디나비안",
            "밝고 자연스러운 북유럽 스타일. 화이트와 우드 톤 중심의 따뜻한 공간."),
        StyleDescriptor.of("modern", "모던",
            "현대적이고 세련된 디자인. 심플하면서도 기능적인 가구와 중성 색상."),
        StyleDescriptor.of("vintage", "빈티지",
            "레트로 감성의 따뜻한 공간. 앤틱 가구와 부드러운 색감."),
        StyleDescriptor.of("industrial", "인더스트리얼",
            "도시적이고 거친 매력. 노출 천장, 벽돌, 금속 소재 활용.")
    );

    private final List<StyleDescriptor> styles;

    private InMemoryStyleCatalog(List<StyleDescriptor> styles) {
        if (styles == null) {
            throw new IllegalArgumentException("styles cannot be null");
        }
        Set<String> ids = new HashSet<>();
        for (StyleDescriptor style : styles) {
            if (style == null) {
                throw new IllegalArgumentException("styles cannot contain null");
            }
            if (!ids.add(style.id())) {
                throw new IllegalArgumentException("Duplicate style id: " + style.id());
            }
        }
        this.styles = List.copyOf(styles);
    }

    /**
     * 기본 인테리어 스타일 카탈로그.
     *
     * @return 다섯 가지 기본 스타일을 담은 카탈로그
     */
    public static InMemoryStyleCatalog defaults() {
        return new InMemoryStyleCatalog(DEFAULT_STYLES);
    }

    /**
     * 지정한 스타일 목록으로 카탈로그 생성.
     *
     * @param styles 스타일 목록 (순서 유지)
     * @return InMemoryStyleCatalog 인스턴스
     * @throws IllegalArgumentException null이거나 ID가 중복된 경우
     */
    public static InMemoryStyleCatalog of(List<StyleDescriptor> styles) {
        return new InMemoryStyleCatalog(styles);
    }

    /**
     * 지정한 스타일들로 카탈로그 생성.
     *
     * @param styles 스타일 (순서 유지)
     * @return InMemoryStyleCatalog 인스턴스
     * @throws IllegalArgumentException null이거나 ID가 중복된 경우
     */
    public static InMemoryStyleCatalog of(StyleDescriptor... styles) {
        if (styles == null) {
            throw new IllegalArgumentException("styles cannot be null");
        }
        return new InMemoryStyleCatalog(List.of(styles));
    }

    @Override
    public List<StyleDescriptor> styles() {
        return styles;
    }

    /**
     * 카탈로그 크기.
     *
     * @return 스타일 수
     */
    public int size() {
        return styles.size();
    }
}
