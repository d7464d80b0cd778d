/**
 * In-memory 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.stylebatch.core.spi.StyleCatalog}와
 * {@link com.ryuqq.stylebatch.core.spi.ArtifactCleaner}의 참조 구현을 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.adapter.inmemory.InMemoryStyleCatalog}:
 *       고정 스타일 목록 (기본 인테리어 스타일 5종 포함)</li>
 *   <li>{@link com.ryuqq.stylebatch.adapter.inmemory.InMemoryArtifactCleaner}:
 *       폐기 요청 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.adapter.inmemory;
