package com.ryuqq.stylebatch.testkit.contract;

import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.GenerationResult;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 클라이언트가 RuntimeException이 아닌 예외를 던지는 경우.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Error (OutOfMemoryError) → 해당 스타일만 1회 시도 후 실패, 배치는 N개 결과 반환</li>
 *   <li>선언되지 않은 검사 예외 → 동일하게 실패로 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ClientErrorContractTest extends AbstractBatchContractTest {

    @Test
    void testClientError_OutOfMemory_OtherStylesSucceed() {
        // Given
        client.script("vintage", (style, source) -> {
            throw new OutOfMemoryError("image decode");
        });

        // When
        BatchResult result = assertDoesNotThrow(() -> runner.runBatch(artifact, catalog, fastConfig()));

        // Then
        assertBatchInvariants(result, catalog.styles());
        TaskOutcome vintage = outcomeOf(result, "vintage");
        assertFalse(vintage.success());
        assertEquals("image decode", vintage.error());
        assertEquals(1, vintage.attempts());
        assertEquals(1, client.callCount("vintage"));
        assertEquals(4, result.succeeded());
    }

    @Test
    void testClientError_UndeclaredCheckedException_RecordedAsFailure() {
        // Given
        client.script("modern", (style, source) -> sneakyThrow(new IOException("disk read failed")));

        // When
        BatchResult result = assertDoesNotThrow(() -> runner.runBatch(artifact, catalog, fastConfig()));

        // Then
        assertBatchInvariants(result, catalog.styles());
        TaskOutcome modern = outcomeOf(result, "modern");
        assertFalse(modern.success());
        assertEquals("disk read failed", modern.error());
        assertEquals(1, modern.attempts());
        assertEquals(4, result.succeeded());
    }

    @Test
    void testClientError_EveryStyleThrowsError_AllFailed() {
        // Given
        client.fallback((style, source) -> {
            throw new NoClassDefFoundError("com/example/ImageCodec");
        });

        // When
        BatchResult result = runner.runBatch(artifact, catalog, fastConfig());

        // Then
        assertBatchInvariants(result, catalog.styles());
        assertEquals(0, result.succeeded());
        assertEquals(5, result.failed());
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> GenerationResult sneakyThrow(Throwable throwable) throws T {
        throw (T) throwable;
    }
}
