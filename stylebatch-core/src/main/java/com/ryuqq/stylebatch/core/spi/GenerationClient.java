package com.ryuqq.stylebatch.core.spi;

import com.ryuqq.stylebatch.core.failure.GenerationException;
import com.ryuqq.stylebatch.core.model.GenerationResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;

/**
 * 외부 이미지 생성 서비스 SPI.
 *
 * <p>원본 이미지와 스타일을 받아 변환 이미지를 한 번 생성합니다.
 * 지연 시간이 수 초에서 수십 초에 이르며, 재시도는 호출자가 담당합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe: 여러 TaskRunner가 동시에 호출</li>
 *   <li>실패 시 분류된 {@link GenerationException}을 던질 것
 *       (분류할 수 없는 예외는 메시지 휴리스틱으로 분류됨)</li>
 *   <li>취소: 스레드 인터럽트에 협조적으로 반응하는 것을 권장
 *       (반응하지 않으면 데드라인 이후 백그라운드에서 계속 실행될 수 있음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface GenerationClient {

    /**
     * 스타일 변환 이미지 생성 (단일 시도).
     *
     * @param style 적용할 스타일
     * @param artifact 원본 이미지
     * @return 생성 결과
     * @throws GenerationException 생성 실패 시
     */
    GenerationResult generate(StyleDescriptor style, SourceArtifact artifact);
}
