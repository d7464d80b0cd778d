package com.ryuqq.stylebatch.testkit.contract;

import com.ryuqq.stylebatch.adapter.inmemory.InMemoryStyleCatalog;
import com.ryuqq.stylebatch.adapter.runner.ParallelBatchRunner;
import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.model.TaskOutcome;
import com.ryuqq.stylebatch.testkit.client.ScriptedGenerationClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for batch Contract Tests.
 *
 * <p>매 테스트마다 새 {@link ScriptedGenerationClient}, {@link ParallelBatchRunner},
 * 기본 카탈로그를 준비하고, 종료 시 워커 풀을 정리합니다.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>client: 스타일별 응답 시나리오</li>
 *   <li>runner: client를 사용하는 ParallelBatchRunner</li>
 *   <li>catalog: 기본 인테리어 스타일 5종</li>
 *   <li>artifact: 메모리 기반 원본 ("room.jpg")</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractBatchContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         client.script("modern", ScriptedGenerationClient.failPermanent("bad input"));
 *
 *         BatchResult result = runner.runBatch(artifact, catalog, fastConfig());
 *
 *         assertBatchInvariants(result, catalog.styles());
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractBatchContractTest {

    protected ScriptedGenerationClient client;
    protected ParallelBatchRunner runner;
    protected InMemoryStyleCatalog catalog;
    protected SourceArtifact artifact;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUp() {
        client = new ScriptedGenerationClient();
        runner = new ParallelBatchRunner(client);
        catalog = InMemoryStyleCatalog.defaults();
        artifact = SourceArtifact.of("room.jpg", null);
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        if (runner != null) {
            runner.shutdown();
        }
    }

    /**
     * 빠른 테스트용 설정 (백오프 20ms, 데드라인 5초, 유예 200ms).
     *
     * @return BatchConfig
     */
    protected BatchConfig fastConfig() {
        return new BatchConfig()
            .withBaseBackoff(Duration.ofMillis(20))
            .withMaxBackoff(Duration.ofMillis(500))
            .withDeadline(Duration.ofSeconds(5))
            .withGracePeriod(Duration.ofMillis(200));
    }

    /**
     * 번호가 붙은 스타일 목록 생성.
     *
     * @param count 스타일 수
     * @return style-1 .. style-N
     */
    protected List<StyleDescriptor> numberedStyles(int count) {
        List<StyleDescriptor> styles = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            styles.add(StyleDescriptor.of("style-" + i, "스타일 " + i, "테스트 스타일 " + i));
        }
        return styles;
    }

    /**
     * BatchResult 공통 불변식 검증.
     *
     * <p>outcome 수, 카탈로그 순서, 집계 일치, 성공/실패 필드 배타성을 확인합니다.</p>
     *
     * @param result 검증할 결과
     * @param styles 요청한 스타일 목록
     */
    protected void assertBatchInvariants(BatchResult result, List<StyleDescriptor> styles) {
        assertNotNull(result, "BatchResult should never be null");
        assertEquals(artifact.getRef(), result.originalRef());
        assertEquals(styles.size(), result.total());
        assertEquals(styles.size(), result.outcomes().size());
        assertEquals(result.total(), result.succeeded() + result.failed());

        for (int i = 0; i < styles.size(); i++) {
            TaskOutcome outcome = result.outcomes().get(i);
            assertEquals(styles.get(i).id(), outcome.styleId(),
                String.format("Outcome %d should belong to style %s but was %s", i, styles.get(i).id(), outcome.styleId()));
            assertEquals(styles.get(i).name(), outcome.styleName());
            if (outcome.success()) {
                assertNotNull(outcome.generatedRef());
                assertNull(outcome.error());
            } else {
                assertNull(outcome.generatedRef());
                assertNotNull(outcome.error());
            }
        }
    }

    /**
     * 스타일 ID로 outcome 조회.
     *
     * @param result 배치 결과
     * @param styleId 스타일 ID
     * @return 해당 outcome
     */
    protected TaskOutcome outcomeOf(BatchResult result, String styleId) {
        return result.outcomes().stream()
            .filter(outcome -> outcome.styleId().equals(styleId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No outcome for style " + styleId));
    }
}
