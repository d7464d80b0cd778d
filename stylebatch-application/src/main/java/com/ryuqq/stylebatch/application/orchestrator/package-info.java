/**
 * Orchestrator 계약 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.application.orchestrator.BatchOrchestrator} - 배치 실행 조정자</li>
 *   <li>{@link com.ryuqq.stylebatch.application.orchestrator.BatchConfig} - 배치 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ParallelBatchRunner)
 *   ↓ implements
 * application (BatchOrchestrator interface)
 *   ↓ depends on
 * core (StyleDescriptor, SourceArtifact, TaskOutcome, BatchResult, SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.application.orchestrator;
