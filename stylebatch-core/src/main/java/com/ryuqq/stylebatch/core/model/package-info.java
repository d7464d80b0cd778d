/**
 * 배치 도메인 모델.
 *
 * <p>모든 타입은 배치 범위이며 불변입니다. 배치 요청이 시작될 때 생성되고
 * 응답이 전송된 후 폐기됩니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.core.model.StyleDescriptor} - 스타일 정의</li>
 *   <li>{@link com.ryuqq.stylebatch.core.model.SourceArtifact} - 원본 이미지 핸들</li>
 *   <li>{@link com.ryuqq.stylebatch.core.model.GenerationResult} - 호출 1회의 성공 결과</li>
 *   <li>{@link com.ryuqq.stylebatch.core.model.TaskOutcome} - 스타일별 최종 결과</li>
 *   <li>{@link com.ryuqq.stylebatch.core.model.BatchResult} - 배치 전체 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.core.model;
