package com.ryuqq.stylebatch.testkit.contract;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 결과 순서와 개수.
 *
 * <p>완료 순서와 무관하게 outcome은 카탈로그 순서로 정확히 N개 반환되어야 하며,
 * 배치는 데드라인 안에 끝나야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrderingContractTest extends AbstractBatchContractTest {

    @Test
    void testOrdering_ReverseCompletionOrder_OutcomesFollowCatalogOrder() {
        // Given: 앞선 스타일일수록 늦게 끝남
        List<StyleDescriptor> styles = catalog.styles();
        for (int i = 0; i < styles.size(); i++) {
            long delayMs = (styles.size() - i) * 60L;
            client.script(styles.get(i).id(),
                ScriptedGenerationClient.delayed(Duration.ofMillis(delayMs), ScriptedGenerationClient.succeed()));
        }
        BatchConfig config = fastConfig();

        // When
        BatchResult result = runner.runBatch(artifact, catalog, config);

        // Then
        assertBatchInvariants(result, styles);
        assertEquals(5, result.succeeded());
        assertTrue(result.totalElapsed().compareTo(config.deadline().plusSeconds(1)) < 0,
            "Batch should finish within deadline + epsilon");
    }

    @Test
    void testOrdering_MixedOutcomes_KeepCatalogOrder() {
        // Given
        client.script("scandinavian", ScriptedGenerationClient.failPermanent("invalid image"))
            .script("vintage", ScriptedGenerationClient.delayed(Duration.ofMillis(150), ScriptedGenerationClient.succeed()))
            .script("industrial", ScriptedGenerationClient.failPermanent("safety filter"));

        // When
        BatchResult result = runner.runBatch(artifact, catalog, fastConfig());

        // Then
        assertBatchInvariants(result, catalog.styles());
        assertEquals(3, result.succeeded());
        assertEquals(2, result.failed());
        assertFalse(result.outcomes().get(1).success());
        assertFalse(result.outcomes().get(4).success());
    }

    @Test
    void testOrdering_ExplicitStyleList_OnlyRequestedStylesRun() {
        // Given
        List<StyleDescriptor> styles = numberedStyles(8);

        // When
        BatchResult result = runner.runBatch(artifact, styles, fastConfig());

        // Then
        assertBatchInvariants(result, styles);
        assertEquals(8, client.totalCalls());
        for (TaskOutcome outcome : result.outcomes()) {
            assertEquals(outcome.styleId() + "_room.jpg", outcome.generatedRef());
        }
    }

    @Test
    void testOrdering_EmptyStyleList_RejectedUpFront() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> runner.runBatch(artifact, List.of(), fastConfig()));
        assertEquals(0, client.totalCalls());
    }

    @Test
    void testOrdering_DuplicateStyleIds_RejectedUpFront() {
        // Given
        StyleDescriptor modern = StyleDescriptor.of("modern", "모던", "desc");
        List<StyleDescriptor> styles = List.of(modern, StyleDescriptor.of("modern", "모던 2", "desc"));

        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> runner.runBatch(artifact, styles, fastConfig()));
        assertTrue(exception.getMessage().contains("Duplicate style id"));
        assertEquals(0, client.totalCalls());
    }
}
