/**
 * 외부 협력자 SPI 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.core.spi.GenerationClient} - 외부 이미지 생성 서비스</li>
 *   <li>{@link com.ryuqq.stylebatch.core.spi.StyleCatalog} - 스타일 카탈로그</li>
 *   <li>{@link com.ryuqq.stylebatch.core.spi.ArtifactCleaner} - 원본 이미지 정리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.core.spi;
