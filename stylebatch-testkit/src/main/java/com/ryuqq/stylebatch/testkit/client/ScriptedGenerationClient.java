package com.ryuqq.stylebatch.testkit.client;

import com.ryuqq.stylebatch.core.failure.FailureClass;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import com.ryuqq.stylebatch.core.failure.GenerationException;
import com.ryuqq.stylebatch.core.model.GenerationResult;
import com.ryuqq.stylebatch.core.model.SourceArtifact;
import com.ryuqq.stylebatch.core.model.StyleDescriptor;
import com.ryuqq.stylebatch.core.spi.GenerationClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스타일별 응답을 미리 지정하는 테스트용 {@link GenerationClient}.
 *
 * <p>스타일마다 응답 순서를 지정하면 호출 순서대로 소비되며, 마지막 응답은
 * 이후 호출에도 반복 사용됩니다. 지정되지 않은 스타일은 fallback 응답(기본: 즉시 성공)을 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedGenerationClient client = new ScriptedGenerationClient()
 *     .script("modern",
 *         ScriptedGenerationClient.failTransient("503 Service Unavailable"),
 *         ScriptedGenerationClient.succeed("modern-ok.png"))
 *     .script("vintage", ScriptedGenerationClient.failPermanent("invalid image"));
 * </pre>
 *
 * <p>호출 횟수와 호출 시각(nanoTime)을 스타일별로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedGenerationClient implements GenerationClient {

    /**
     * 단일 호출에 대한 응답.
     */
    @FunctionalInterface
    public interface Response {

        /**
         * 응답 생성.
         *
         * @param style 호출된 스타일
         * @param artifact 원본
         * @return 생성 결과
         * @throws InterruptedException 대기 중 인터럽트된 경우
         */
        GenerationResult respond(StyleDescriptor style, SourceArtifact artifact) throws InterruptedException;
    }

    private final Map<String, Deque<Response>> scripts = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> callNanos = new ConcurrentHashMap<>();
    private final AtomicInteger totalCalls = new AtomicInteger();
    private volatile Response fallback = succeed();

    /**
     * 스타일 응답 순서 지정.
     *
     * @param styleId 스타일 ID
     * @param responses 호출 순서대로 사용할 응답 (마지막 응답은 반복)
     * @return this
     */
    public ScriptedGenerationClient script(String styleId, Response... responses) {
        if (styleId == null) {
            throw new IllegalArgumentException("styleId cannot be null");
        }
        if (responses == null || responses.length == 0) {
            throw new IllegalArgumentException("responses cannot be null or empty");
        }
        scripts.put(styleId, new ConcurrentLinkedDeque<>(List.of(responses)));
        return this;
    }

    /**
     * 지정되지 않은 스타일의 응답 설정.
     *
     * @param response fallback 응답
     * @return this
     */
    public ScriptedGenerationClient fallback(Response response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        this.fallback = response;
        return this;
    }

    @Override
    public GenerationResult generate(StyleDescriptor style, SourceArtifact artifact) {
        totalCalls.incrementAndGet();
        callNanos.computeIfAbsent(style.id(), id -> new CopyOnWriteArrayList<>()).add(System.nanoTime());

        Response response = next(style.id());
        try {
            return response.respond(style, artifact);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(new GenerationError(FailureClass.CANCELLED, "generation interrupted"), e);
        }
    }

    /**
     * 스타일별 호출 횟수.
     *
     * @param styleId 스타일 ID
     * @return 호출 횟수
     */
    public int callCount(String styleId) {
        List<Long> calls = callNanos.get(styleId);
        return calls == null ? 0 : calls.size();
    }

    /**
     * 전체 호출 횟수.
     *
     * @return 호출 횟수
     */
    public int totalCalls() {
        return totalCalls.get();
    }

    /**
     * 스타일별 호출 간격.
     *
     * @param styleId 스타일 ID
     * @return 연속된 두 호출 사이의 간격 목록
     */
    public List<Duration> callGaps(String styleId) {
        List<Long> calls = callNanos.getOrDefault(styleId, List.of());
        List<Duration> gaps = new ArrayList<>();
        for (int i = 1; i < calls.size(); i++) {
            gaps.add(Duration.ofNanos(calls.get(i) - calls.get(i - 1)));
        }
        return gaps;
    }

    private Response next(String styleId) {
        Deque<Response> script = scripts.get(styleId);
        if (script == null) {
            return fallback;
        }
        synchronized (script) {
            return script.size() > 1 ? script.pollFirst() : script.peekFirst();
        }
    }

    // ============================================================
    // 응답 팩토리
    // ============================================================

    /**
     * 즉시 성공 (참조: {@code styleId_originalRef}).
     *
     * @return Response
     */
    public static Response succeed() {
        return (style, artifact) -> new GenerationResult(
            style.id() + "_" + artifact.getRef(), style.name() + " 스타일 적용");
    }

    /**
     * 지정한 참조로 즉시 성공.
     *
     * @param generatedRef 생성 결과 참조
     * @return Response
     */
    public static Response succeed(String generatedRef) {
        return (style, artifact) -> GenerationResult.of(generatedRef);
    }

    /**
     * TRANSIENT 실패.
     *
     * @param message 오류 메시지
     * @return Response
     */
    public static Response failTransient(String message) {
        return (style, artifact) -> {
            throw GenerationException.transientFailure(message);
        };
    }

    /**
     * PERMANENT 실패.
     *
     * @param message 오류 메시지
     * @return Response
     */
    public static Response failPermanent(String message) {
        return (style, artifact) -> {
            throw GenerationException.permanentFailure(message);
        };
    }

    /**
     * 분류되지 않은 예외 발생 (FailureClassifier 경계 검증용).
     *
     * @param exception 던질 예외
     * @return Response
     */
    public static Response throwing(RuntimeException exception) {
        return (style, artifact) -> {
            throw exception;
        };
    }

    /**
     * 결과 없음 (null 반환).
     *
     * @return Response
     */
    public static Response returnsNull() {
        return (style, artifact) -> null;
    }

    /**
     * 지연 후 다음 응답 수행 (인터럽트 시 중단).
     *
     * @param delay 지연 시간
     * @param then 지연 후 응답
     * @return Response
     */
    public static Response delayed(Duration delay, Response then) {
        return (style, artifact) -> {
            Thread.sleep(delay.toMillis());
            return then.respond(style, artifact);
        };
    }

    /**
     * 인터럽트될 때까지 응답하지 않음.
     *
     * @return Response
     */
    public static Response hang() {
        return (style, artifact) -> {
            Thread.sleep(Long.MAX_VALUE);
            throw new IllegalStateException("unreachable");
        };
    }
}
