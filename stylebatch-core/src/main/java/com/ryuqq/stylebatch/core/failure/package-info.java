/**
 * 생성 실패 분류 패키지.
 *
 * <p>실패는 {@link com.ryuqq.stylebatch.core.failure.FailureClass}로 분류되며,
 * 재시도 여부는 분류만으로 결정됩니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.core.failure.GenerationError} - 분류된 실패 값</li>
 *   <li>{@link com.ryuqq.stylebatch.core.failure.GenerationException} - 클라이언트 경계 예외</li>
 *   <li>{@link com.ryuqq.stylebatch.core.failure.FailureClassifier} - 메시지 휴리스틱 분류기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.core.failure;
