package com.ryuqq.stylebatch.core.protection.noop;

import com.ryuqq.stylebatch.core.protection.CancellationSignal;
import com.ryuqq.stylebatch.core.protection.ConcurrencyGate;

/**
 * ConcurrencyGate NoOp 구현.
 *
 * <p>동시 호출 수 제한을 적용하지 않습니다.
 * 개발 및 테스트 환경에서 사용하거나, 제한 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 신호가 발화하지 않았다면 항상 true 반환</li>
 *   <li>release(): 아무 동작 안 함</li>
 *   <li>activeCount(): 항상 0 반환</li>
 *   <li>maxConcurrent(): Integer.MAX_VALUE 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpConcurrencyGate implements ConcurrencyGate {

    @Override
    public boolean acquire(CancellationSignal signal) {
        return !signal.isCancelled();
    }

    @Override
    public void release() {
        // NoOp
    }

    @Override
    public int activeCount() {
        return 0;
    }

    @Override
    public int maxConcurrent() {
        return Integer.MAX_VALUE;
    }
}
