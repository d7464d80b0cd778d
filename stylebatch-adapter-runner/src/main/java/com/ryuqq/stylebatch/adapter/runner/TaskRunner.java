package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.core.failure.FailureClass;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.failure.GenerationException;
import com.ryuqq.stylebatch.core.model.GenerationResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.core.protection.CancellationSignal;
import com.ryuqq.stylebatch.core.protection.ConcurrencyGate;
import com.ryuqq.stylebatch.core.protection.RetryPolicy;
import com.ryuqq.stylebatch.core.spi.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 스타일 하나의 전체 생명주기를 실행하는 작업 단위.
 *
 * <p>슬롯 획득 → 호출 → 실패 시 재시도 판단 → 백오프 대기를 반복하여
 * 정확히 하나의 {@link TaskOutcome}을 만들어 냅니다.
 * 어떤 경우에도 예외를 밖으로 던지지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 0 .. maxAttempts-1:
 *   1. gate.acquire(signal)   → 실패 시 "cancelled"
 *   2. client.generate(...)   → 반환 즉시 gate.release()
 *   3. 성공                    → succeeded outcome
 *   4. 실패                    → retryPolicy.shouldRetry()
 *        - 재시도 가능 + 신호 미발화 → signal.sleep(backoff) (중단 시 "cancelled")
 *        - 그 외                    → 마지막 오류로 failed outcome
 * 시도 소진 → 마지막 오류로 failed outcome
 * 예상치 못한 Throwable (Error 포함) → 재시도 없이 failed outcome
 * </pre>
 *
 * <p><strong>동시성:</strong> 재시도 상태는 이 인스턴스만 소유하며,
 * 공유 상태는 ConcurrencyGate뿐입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskRunner implements Callable<TaskOutcome> {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final StyleDescriptor style;
    private final SourceArtifact artifact;
    private final GenerationClient client;
    private final ConcurrencyGate gate;
    private final RetryPolicy retryPolicy;
    private final CancellationSignal signal;

    /**
     * 생성자.
     *
     * @param style 처리할 스타일
     * @param artifact 원본 이미지
     * @param client 생성 서비스
     * @param gate 배치 공유 ConcurrencyGate
     * @param retryPolicy 재시도 정책
     * @param signal 배치 취소 신호
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TaskRunner(StyleDescriptor style, SourceArtifact artifact, GenerationClient client,
                      ConcurrencyGate gate, RetryPolicy retryPolicy, CancellationSignal signal) {
        if (style == null) {
            throw new IllegalArgumentException("style cannot be null");
        }
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        this.style = style;
        this.artifact = artifact;
        this.client = client;
        this.gate = gate;
        this.retryPolicy = retryPolicy;
        this.signal = signal;
    }

    /**
     * 작업 실행.
     *
     * @return 이 스타일의 TaskOutcome (null 아님)
     */
    @Override
    public TaskOutcome call() {
        long startNanos = System.nanoTime();
        int attempts = 0;
        GenerationError lastError = null;

        try {
            for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
                // 1. 슬롯 획득 (취소 가능)
                if (!gate.acquire(signal)) {
                    log.debug("Style {} cancelled while waiting for a slot (attempt {})", style.id(), attempt);
                    return TaskOutcome.cancelled(style, elapsedSince(startNanos), attempts);
                }

                // 2. 호출 (슬롯은 호출 직후 반환)
                GenerationResult result = null;
                GenerationError error;
                attempts++;
                try {
                    result = client.generate(style, artifact);
                    error = result == null ? GenerationError.permanent("Generation returned no result") : null;
                } catch (GenerationException e) {
                    error = e.getError();
                } catch (RuntimeException e) {
                    error = GenerationError.from(e);
                } finally {
                    gate.release();
                }

                // 3. 성공
                if (error == null) {
                    Duration elapsed = elapsedSince(startNanos);
                    log.info("Style {} generated {} in {}ms (attempts: {})",
                        style.id(), result.generatedRef(), elapsed.toMillis(), attempts);
                    return TaskOutcome.succeeded(style, result, elapsed, attempts);
                }

                // 4. 실패 처리
                lastError = error;
                if (error.failureClass() == FailureClass.CANCELLED || Thread.currentThread().isInterrupted()) {
                    log.debug("Style {} call interrupted: {}", style.id(), error.message());
                    return TaskOutcome.cancelled(style, elapsedSince(startNanos), attempts);
                }
                if (!retryPolicy.shouldRetry(error, attempt) || signal.isCancelled()) {
                    break;
                }

                Duration backoff = retryPolicy.backoffFor(attempt);
                log.warn("Transient failure for style {} (attempt {}/{}), retrying in {}ms: {}",
                    style.id(), attempt + 1, retryPolicy.maxAttempts(), backoff.toMillis(), error.message());
                if (!signal.sleep(backoff)) {
                    log.debug("Style {} cancelled during backoff", style.id());
                    return TaskOutcome.cancelled(style, elapsedSince(startNanos), attempts);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.cancelled(style, elapsedSince(startNanos), attempts);
        } catch (Throwable e) {
            // Error 및 선언되지 않은 검사 예외 포함, 재시도하지 않음
            log.error("Unexpected failure while running style {}", style.id(), e);
            return TaskOutcome.failed(style, GenerationError.from(e).message(), elapsedSince(startNanos), attempts);
        }

        String message = lastError != null ? lastError.message() : "No attempt was made";
        log.warn("Style {} failed after {} attempt(s): {}", style.id(), attempts, message);
        return TaskOutcome.failed(style, message, elapsedSince(startNanos), attempts);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
