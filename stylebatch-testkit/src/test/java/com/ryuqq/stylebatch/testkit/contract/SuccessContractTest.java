package com.ryuqq.stylebatch.testkit.contract;

import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 전체 성공과 멱등성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SuccessContractTest extends AbstractBatchContractTest {

    @Test
    void testSuccess_AllStylesSucceed_CountsMatch() {
        // When
        BatchResult result = runner.runBatch(artifact, catalog, fastConfig());

        // Then
        assertBatchInvariants(result, catalog.styles());
        assertEquals(5, result.succeeded());
        assertEquals(0, result.failed());
        assertTrue(result.hasAnySuccess());
        assertEquals(0, result.deadlineExceededCount());
        for (TaskOutcome outcome : result.outcomes()) {
            assertTrue(outcome.success());
            assertEquals(1, outcome.attempts());
            assertNotNull(outcome.analysisText(), "analysis text should flow into the outcome");
        }
    }

    @Test
    void testSuccess_SameScriptTwice_SameSuccessFlags() {
        // Given
        client.script("modern", ScriptedGenerationClient.failPermanent("policy violation"))
            .script("industrial", ScriptedGenerationClient.failPermanent("policy violation"));

        // When
        BatchResult first = runner.runBatch(artifact, catalog, fastConfig());
        BatchResult second = runner.runBatch(artifact, catalog, fastConfig());

        // Then
        assertEquals(successFlags(first), successFlags(second));
        assertEquals(first.succeeded(), second.succeeded());
        assertEquals(3, second.succeeded());
    }

    private List<Boolean> successFlags(BatchResult result) {
        return result.outcomes().stream()
            .map(TaskOutcome::success)
            .collect(Collectors.toList());
    }
}
