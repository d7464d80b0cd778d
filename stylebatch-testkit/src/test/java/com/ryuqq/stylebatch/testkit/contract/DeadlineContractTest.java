package com.ryuqq.stylebatch.testkit.contract;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 배치 데드라인.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>모든 호출이 응답하지 않음 → 전부 "deadline exceeded", 즉시 반환</li>
 *   <li>일부만 응답하지 않음 → 부분 성공</li>
 *   <li>백오프가 데드라인보다 김 → 대기 중단</li>
 *   <li>슬롯 대기 중 데드라인 → 호출 없이 "deadline exceeded"</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeadlineContractTest extends AbstractBatchContractTest {

    private static final Duration SHORT_DEADLINE = Duration.ofMillis(300);
    private static final Duration PROMPT_RETURN = Duration.ofMillis(1500);

    private BatchConfig shortDeadline() {
        return fastConfig()
            .withDeadline(SHORT_DEADLINE)
            .withGracePeriod(Duration.ofMillis(200));
    }

    @Test
    void testDeadline_AllCallsHang_AllDeadlineExceeded() {
        // Given
        client.fallback(ScriptedGenerationClient.hang());

        // When
        BatchResult result = runner.runBatch(artifact, catalog, shortDeadline());

        // Then
        assertBatchInvariants(result, catalog.styles());
        assertEquals(0, result.succeeded());
        assertEquals(5, result.deadlineExceededCount());
        for (TaskOutcome outcome : result.outcomes()) {
            assertEquals(TaskOutcome.DEADLINE_EXCEEDED, outcome.error());
        }
        assertTrue(result.exceeded(SHORT_DEADLINE));
        assertTrue(result.totalElapsed().compareTo(PROMPT_RETURN) < 0,
            "Batch should return promptly after the deadline but took " + result.totalElapsed());
    }

    @Test
    void testDeadline_SomeCallsHang_PartialSuccess() {
        // Given
        client.fallback(ScriptedGenerationClient.hang())
            .script("minimalist", ScriptedGenerationClient.succeed())
            .script("modern", ScriptedGenerationClient.failPermanent("invalid image"));

        // When
        BatchResult result = runner.runBatch(artifact, catalog, shortDeadline());

        // Then
        assertBatchInvariants(result, catalog.styles());
        assertEquals(1, result.succeeded());
        assertTrue(outcomeOf(result, "minimalist").success());
        assertEquals("invalid image", outcomeOf(result, "modern").error());
        assertEquals(3, result.deadlineExceededCount());
    }

    @Test
    void testDeadline_BackoffLongerThanDeadline_SleepAbandoned() {
        // Given
        client.script("vintage", ScriptedGenerationClient.failTransient("503 unavailable"));
        BatchConfig config = shortDeadline()
            .withMaxBackoff(Duration.ofSeconds(10))
            .withBaseBackoff(Duration.ofSeconds(10));

        // When
        BatchResult result = runner.runBatch(artifact, catalog, config);

        // Then
        TaskOutcome vintage = outcomeOf(result, "vintage");
        assertTrue(vintage.isDeadlineExceeded());
        assertEquals(1, vintage.attempts());
        assertEquals(4, result.succeeded());
        assertTrue(result.totalElapsed().compareTo(PROMPT_RETURN) < 0);
    }

    @Test
    void testDeadline_WaitingForSlot_NoCallMade() {
        // Given: 슬롯 1개를 첫 호출이 점유
        client.fallback(ScriptedGenerationClient.hang());
        BatchConfig config = shortDeadline().withMaxConcurrent(1);

        // When
        BatchResult result = runner.runBatch(artifact, catalog, config);

        // Then
        assertEquals(5, result.deadlineExceededCount());
        assertEquals(1, client.totalCalls());
        long withoutCall = result.outcomes().stream().filter(outcome -> outcome.attempts() == 0).count();
        assertEquals(4, withoutCall);
    }

    @Test
    void testDeadline_FastBatch_NotExceeded() {
        // When
        BatchResult result = runner.runBatch(artifact, catalog, shortDeadline());

        // Then
        assertEquals(5, result.succeeded());
        assertFalse(result.exceeded(SHORT_DEADLINE));
    }
}
