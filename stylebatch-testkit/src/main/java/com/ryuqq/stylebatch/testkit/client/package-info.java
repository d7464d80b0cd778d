/**
 * 테스트용 GenerationClient 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient}: 스타일별 응답 시나리오</li>
 *   <li>{@link com.ryuqq.stylebatch.testkit.client.ConcurrencyProbeClient}: 최대 동시 호출 수 측정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.testkit.client;
