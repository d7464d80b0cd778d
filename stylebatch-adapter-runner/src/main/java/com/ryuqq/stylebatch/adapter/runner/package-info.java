/**
 * 병렬 배치 러너 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.stylebatch.application.orchestrator.BatchOrchestrator}의
 * 스레드 풀 기반 구현체와 보호 SPI 구현체를 제공합니다.</p>
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.adapter.runner.ParallelBatchRunner}:
 *       스타일별 TaskRunner를 동시에 실행하고 데드라인을 강제</li>
 *   <li>{@link com.ryuqq.stylebatch.adapter.runner.TaskRunner}:
 *       스타일 하나의 슬롯 획득, 호출, 재시도 루프</li>
 *   <li>{@link com.ryuqq.stylebatch.adapter.runner.SemaphoreConcurrencyGate}:
 *       공정(FIFO) 세마포어 기반 동시 호출 제한</li>
 *   <li>{@link com.ryuqq.stylebatch.adapter.runner.ExponentialBackoffRetryPolicy}:
 *       TRANSIENT 오류 한정 지수 백오프 재시도</li>
 *   <li>{@link com.ryuqq.stylebatch.adapter.runner.DeadlineSignal}:
 *       배치 데드라인 기반 취소 신호</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ParallelBatchRunner runner = new ParallelBatchRunner(client);
 * BatchResult result = runner.runBatch(artifact, catalog, new BatchConfig());
 * runner.shutdown();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.adapter.runner;
