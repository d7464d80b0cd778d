package com.ryuqq.stylebatch.testkit.client;

import com.ryuqq.stylebatch.core.failure.FailureClass;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.failure.GenerationException;
import com.ryuqq.stylebatch.core.model.GenerationResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.spi.GenerationClient;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동시 호출 수를 측정하는 테스트용 {@link GenerationClient}.
 *
 * <p>매 호출마다 지정한 시간만큼 대기한 뒤 성공하며,
 * 동시에 진행 중인 호출 수의 최댓값을 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrencyProbeClient implements GenerationClient {

    private final Duration latency;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param latency 호출당 대기 시간
     * @throws IllegalArgumentException latency가 null이거나 음수인 경우
     */
    public ConcurrencyProbeClient(Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency cannot be null or negative (current: " + latency + ")");
        }
        this.latency = latency;
    }

    @Override
    public GenerationResult generate(StyleDescriptor style, SourceArtifact artifact) {
        calls.incrementAndGet();
        int current = inFlight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
        try {
            Thread.sleep(latency.toMillis());
            return GenerationResult.of(style.id() + "_" + artifact.getRef());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(new GenerationError(FailureClass.CANCELLED, "generation interrupted"), e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * 관측된 최대 동시 호출 수.
     *
     * @return peak 값
     */
    public int peakConcurrency() {
        return peak.get();
    }

    /**
     * 전체 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int totalCalls() {
        return calls.get();
    }
}
