package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.application.orchestrator.BatchOrchestrator;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.core.protection.ConcurrencyGate;
import com.ryuqq.stylebatch.core.protection.RetryPolicy;
import com.ryuqq.stylebatch.core.spi.GenerationClient;
import com.ryuqq.stylebatch.core.statemachine.BatchState;
import com.ryuqq.stylebatch.core.statemachine.BatchStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 병렬 배치 러너 구현체.
 *
 * <p>스타일마다 {@link TaskRunner}를 하나씩 동시에 시작하고, 외부 호출은
 * 배치 공유 {@link SemaphoreConcurrencyGate}로 제한합니다. 단일 데드라인 안에
 * 항상 {@link BatchResult}를 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runBatch() 호출
 *   ↓
 * 입력 검증 (빈 목록, 중복 ID → IllegalArgumentException)
 *   ↓
 * DeadlineSignal 무장 + Gate(maxConcurrent) + RetryPolicy 생성
 *   ↓
 * For each style: workerExecutor.submit(TaskRunner) → slot[i]에 결과 기록
 *   ↓
 * 데드라인까지 대기
 *   ├─ 모두 완료 → ALL_COMPLETED
 *   └─ 데드라인 → DEADLINE_EXCEEDED
 *        1. signal.cancel() + 미완료 Future 인터럽트
 *        2. gracePeriod 동안 취소 결과 대기
 *        3. 빈 슬롯 및 취소 결과 → "deadline exceeded"
 *   ↓
 * 카탈로그 순서로 조립 → FINALIZED
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>결과 슬롯은 compareAndSet으로 기록되어, 늦게 도착한 실제 결과와
 *       합성 결과 중 먼저 기록된 하나만 남음</li>
 *   <li>대기열에서 시작되지 못한 작업은 데드라인 시 러너가 회수하여 유예 대기를 막지 않음</li>
 *   <li>인터럽트에 반응하지 않는 호출은 데드라인 이후 백그라운드에서 계속될 수 있으나,
 *       러너는 기다리지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParallelBatchRunner implements BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelBatchRunner.class);

    private final GenerationClient client;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 워커 풀 사용).
     *
     * <p>데몬 스레드로 구성된 캐시 스레드 풀을 사용합니다.</p>
     *
     * @param client 생성 서비스
     * @throws IllegalArgumentException client가 null인 경우
     */
    public ParallelBatchRunner(GenerationClient client) {
        this(client, Executors.newCachedThreadPool(new WorkerThreadFactory()));
    }

    /**
     * 생성자 (커스텀 워커 풀 주입).
     *
     * <p>워커 풀은 배치당 스타일 수 이상의 작업을 동시에 실행할 수 있어야 합니다.</p>
     *
     * @param client 생성 서비스
     * @param workerExecutor 워커 풀
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ParallelBatchRunner(GenerationClient client, ExecutorService workerExecutor) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }
        this.client = client;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public BatchResult runBatch(SourceArtifact artifact, List<StyleDescriptor> styles, BatchConfig config) {
        validateInput(artifact, styles, config);

        // 1. 배치 시작
        long startNanos = System.nanoTime();
        BatchState state = BatchState.RUNNING;
        DeadlineSignal signal = DeadlineSignal.startingNow(config.deadline());
        ConcurrencyGate gate = new SemaphoreConcurrencyGate(config.maxConcurrent());
        RetryPolicy retryPolicy = ExponentialBackoffRetryPolicy.from(config);

        int total = styles.size();
        AtomicReferenceArray<TaskOutcome> slots = new AtomicReferenceArray<>(total);
        CountDownLatch pending = new CountDownLatch(total);
        // 0: 대기열, 1: 시작됨 또는 러너가 회수함. 래치는 슬롯당 한 번만 감소
        AtomicIntegerArray claimed = new AtomicIntegerArray(total);
        List<Future<?>> futures = new ArrayList<>(total);

        log.info("Batch started for {}: {} styles, maxConcurrent={}, maxAttempts={}, deadline={}ms",
            artifact, total, config.maxConcurrent(), config.maxAttempts(), config.deadline().toMillis());

        // 2. 스타일마다 TaskRunner 시작
        for (int i = 0; i < total; i++) {
            StyleDescriptor style = styles.get(i);
            TaskRunner runner = new TaskRunner(style, artifact, client, gate, retryPolicy, signal);
            int index = i;
            try {
                futures.add(workerExecutor.submit(() -> {
                    if (!claimed.compareAndSet(index, 0, 1)) {
                        return;
                    }
                    try {
                        slots.compareAndSet(index, null, runner.call());
                    } catch (Throwable e) {
                        log.error("Worker for style {} terminated abnormally", style.id(), e);
                        slots.compareAndSet(index, null,
                            TaskOutcome.failed(style, GenerationError.from(e).message(), elapsedSince(startNanos), 0));
                    } finally {
                        pending.countDown();
                    }
                }));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected style {}", style.id(), e);
                claimed.set(index, 1);
                slots.compareAndSet(index, null,
                    TaskOutcome.failed(style, "rejected by worker pool", elapsedSince(startNanos), 0));
                pending.countDown();
            }
        }

        // 3. 데드라인까지 대기
        boolean interrupted = false;
        boolean allCompleted;
        try {
            allCompleted = pending.await(signal.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
            allCompleted = false;
        }

        // 4. 데드라인 초과 처리
        if (allCompleted) {
            state = BatchStateTransition.transition(state, BatchState.ALL_COMPLETED);
            // 데드라인 직전에 백오프 취소로 끝난 작업도 "deadline exceeded"로 기록
            if (signal.isCancelled()) {
                settleUnfinished(slots, styles, startNanos, false);
            }
        } else {
            state = BatchStateTransition.transition(state, BatchState.DEADLINE_EXCEEDED);
            signal.cancel();
            // 아직 시작되지 않은 작업은 실행되지 않으므로 여기서 래치 감소
            for (int i = 0; i < total; i++) {
                if (claimed.compareAndSet(i, 0, 1)) {
                    pending.countDown();
                }
            }
            futures.forEach(future -> future.cancel(true));

            if (!interrupted) {
                interrupted = awaitGracePeriod(pending, config.gracePeriod());
            }
            int synthesized = settleUnfinished(slots, styles, startNanos, interrupted);
            log.warn("Batch for {} {}: {} of {} styles did not finish",
                artifact, interrupted ? "was interrupted" : "exceeded deadline", synthesized, total);
        }

        // 5. 카탈로그 순서로 조립 (빈 슬롯 없음)
        List<TaskOutcome> outcomes = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            TaskOutcome outcome = slots.get(i);
            if (outcome == null) {
                outcome = TaskOutcome.failed(styles.get(i), "task produced no outcome", elapsedSince(startNanos), 0);
            }
            outcomes.add(outcome);
        }
        BatchResult result = BatchResult.of(artifact.getRef(), elapsedSince(startNanos), outcomes);
        state = BatchStateTransition.transition(state, BatchState.FINALIZED);

        log.info("Batch {} for {}: {}/{} succeeded, {} failed in {}ms",
            state, artifact, result.succeeded(), result.total(), result.failed(), result.totalElapsed().toMillis());

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    /**
     * 워커 풀 종료 (리소스 정리).
     *
     * <p>진행 중인 작업이 완료되도록 대기하며, 시간 내 끝나지 않으면 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 입력 유효성 검증.
     *
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(SourceArtifact artifact, List<StyleDescriptor> styles, BatchConfig config) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (styles == null || styles.isEmpty()) {
            throw new IllegalArgumentException("styles cannot be null or empty");
        }
        Set<String> ids = new HashSet<>();
        for (StyleDescriptor style : styles) {
            if (style == null) {
                throw new IllegalArgumentException("styles cannot contain null");
            }
            if (!ids.add(style.id())) {
                throw new IllegalArgumentException("Duplicate style id: " + style.id());
            }
        }
    }

    /**
     * 취소 후 유예 시간 동안 결과 대기.
     *
     * @return 대기 중 호출 스레드가 인터럽트되었으면 true
     */
    private boolean awaitGracePeriod(CountDownLatch pending, Duration gracePeriod) {
        try {
            pending.await(gracePeriod.toNanos(), TimeUnit.NANOSECONDS);
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    /**
     * 미완료 작업의 결과 확정.
     *
     * <p>데드라인 초과 시 빈 슬롯과 취소 결과는 "deadline exceeded"로 기록합니다.
     * 호출 스레드가 인터럽트된 경우 빈 슬롯은 "cancelled"로 기록하고 나머지는 유지합니다.</p>
     *
     * @return 확정한 슬롯 수
     */
    private int settleUnfinished(AtomicReferenceArray<TaskOutcome> slots, List<StyleDescriptor> styles,
                                 long startNanos, boolean interrupted) {
        Duration elapsed = elapsedSince(startNanos);
        int settled = 0;

        for (int i = 0; i < slots.length(); i++) {
            StyleDescriptor style = styles.get(i);
            if (interrupted) {
                if (slots.compareAndSet(i, null, TaskOutcome.cancelled(style, elapsed, 0))) {
                    settled++;
                }
                continue;
            }

            if (slots.compareAndSet(i, null, TaskOutcome.deadlineExceeded(style, elapsed))) {
                settled++;
                continue;
            }
            TaskOutcome current = slots.get(i);
            if (current.isCancelled()
                && slots.compareAndSet(i, current, TaskOutcome.deadlineExceeded(style, current.elapsed(), current.attempts()))) {
                settled++;
            }
        }
        return settled;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * 워커 스레드 팩토리 (데몬, 이름 지정).
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stylebatch-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
