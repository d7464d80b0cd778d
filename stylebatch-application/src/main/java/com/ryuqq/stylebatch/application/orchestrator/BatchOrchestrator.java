package com.ryuqq.stylebatch.application.orchestrator;

import com.ryuqq.stylebatch.core.model.BatchResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.spi.StyleCatalog;

import java.util.List;

/**
 * 스타일 배치 실행 조정자.
 *
 * <p>원본 이미지 하나에 대해 스타일마다 변환 작업을 동시에 실행하고,
 * 설정된 데드라인 안에 항상 {@link BatchResult}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchResult result = orchestrator.runBatch(artifact, catalog.styles(), new BatchConfig());
 *
 * if (result.deadlineExceededCount() &gt; 0) {
 *     // 시간 초과로 일부만 완료
 * } else if (result.failed() &gt; 0) {
 *     // 완료했지만 일부 스타일 실패
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BatchOrchestrator {

    /**
     * 배치 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>배치 시작 시각 기록, 데드라인 신호 무장</li>
     *   <li>스타일마다 TaskRunner 하나를 동시에 시작 (ConcurrencyGate 공유)</li>
     *   <li>데드라인까지 모든 작업 완료 대기</li>
     *   <li>데드라인 초과 시: 미완료 작업 취소, 유예 시간 후에도 결과가 없으면 "deadline exceeded" 합성</li>
     *   <li>카탈로그 순서로 outcomes 재정렬, 집계 후 반환</li>
     * </ol>
     *
     * <p>개별 작업의 실패는 모두 outcome 데이터로 기록되며, 이 메서드는
     * 입력이 유효하지 않은 경우에만 예외를 던집니다.</p>
     *
     * @param artifact 원본 이미지
     * @param styles 처리할 스타일 목록 (카탈로그 순서, ID 고유)
     * @param config 배치 설정
     * @return 배치 결과 (outcomes.size() == styles.size())
     * @throws IllegalArgumentException artifact 또는 config가 null이거나, styles가 비어 있거나 ID가 중복된 경우
     */
    BatchResult runBatch(SourceArtifact artifact, List<StyleDescriptor> styles, BatchConfig config);

    /**
     * 카탈로그 전체로 배치 실행.
     *
     * @param artifact 원본 이미지
     * @param catalog 스타일 카탈로그
     * @param config 배치 설정
     * @return 배치 결과
     * @throws IllegalArgumentException catalog가 null이거나 비어 있는 경우
     */
    default BatchResult runBatch(SourceArtifact artifact, StyleCatalog catalog, BatchConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        return runBatch(artifact, catalog.styles(), config);
    }
}
