/**
 * Protection SPI 패키지.
 *
 * <p>외부 생성 서비스 호출을 보호하는 확장점을 정의합니다.</p>
 *
 * <h2>적용 순서</h2>
 * <pre>
 * 1. CancellationSignal → 배치 데드라인 (전체 상한)
 * 2. ConcurrencyGate    → 동시 호출 수 제한
 * 3. GenerationClient   → 실제 호출
 * 4. RetryPolicy        → 실패 시 재시도 여부와 백오프 결정
 * </pre>
 *
 * <p>{@code noop} 하위 패키지는 제한 없는 기본 구현을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.stylebatch.core.protection.ConcurrencyGate
 * @see com.ryuqq.stylebatch.core.protection.RetryPolicy
 * @see com.ryuqq.stylebatch.core.protection.CancellationSignal
 */
package com.ryuqq.stylebatch.core.protection;
