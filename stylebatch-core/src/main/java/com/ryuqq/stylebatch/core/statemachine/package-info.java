/**
 * 배치 상태 머신 패키지.
 *
 * <p>{@code RUNNING -> (ALL_COMPLETED | DEADLINE_EXCEEDED) -> FINALIZED}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.stylebatch.core.statemachine;
