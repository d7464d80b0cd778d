/**
 * 배치 Contract Test 기반 패키지.
 *
 * <p>{@link com.ryuqq.stylebatch.testkit.contract.AbstractBatchContractTest}를 상속하여
 * BatchOrchestrator 구현체가 지켜야 할 동작(순서, 재시도, 동시성 제한, 데드라인)을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.testkit.contract;
