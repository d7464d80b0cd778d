package com.ryuqq.stylebatch.core.failure;

import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

/**
 * 예외 메시지 기반 실패 분류기.
 *
 * <p>생성 서비스가 구조화된 오류 코드를 제공하지 않을 때 클라이언트 경계에서
 * 사용하는 휴리스틱입니다. 타입이 있는 {@link GenerationException}이 있으면
 * 그 분류를 그대로 사용합니다.</p>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>GenerationException → 포함된 FailureClass</li>
 *   <li>InterruptedException, CancellationException → CANCELLED</li>
 *   <li>메시지에 503, 429, rate, rate limit, quota, overload, unavailable,
 *       resource exhausted 포함 → TRANSIENT</li>
 *   <li>그 외 → PERMANENT</li>
 * </ul>
 *
 * <p>단어 경계를 적용하므로 "failed to generate" 같은 메시지는 rate로 해석되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    private static final Pattern TRANSIENT_PATTERN = Pattern.compile(
        "\\b(503|429)\\b"
            + "|\\brate\\b"
            + "|\\brate[\\s_-]?limit"
            + "|\\bquota\\b"
            + "|\\boverload"
            + "|\\bunavailable\\b"
            + "|\\bresource[\\s_-]exhausted\\b"
    );

    // Utility class - prevent instantiation
    private FailureClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 예외 분류.
     *
     * <p>원인 체인 전체를 검사하며, 하나라도 TRANSIENT로 판단되면 TRANSIENT입니다.</p>
     *
     * @param throwable 분류할 예외
     * @return 실패 분류
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static FailureClass classify(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        for (Throwable current = throwable; current != null; current = nextCause(current)) {
            if (current instanceof GenerationException) {
                return ((GenerationException) current).getError().failureClass();
            }
            if (current instanceof InterruptedException || current instanceof CancellationException) {
                return FailureClass.CANCELLED;
            }
            if (isTransientMessage(current.getMessage())) {
                return FailureClass.TRANSIENT;
            }
        }
        return FailureClass.PERMANENT;
    }

    /**
     * 오류 메시지가 일시적 실패 신호를 포함하는지 확인.
     *
     * @param message 오류 메시지 (null 허용)
     * @return 일시적 실패 신호 포함 여부
     */
    public static boolean isTransientMessage(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        return TRANSIENT_PATTERN.matcher(message.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * TaskOutcome.error에 기록할 설명 생성.
     *
     * @param throwable 예외
     * @return 메시지, 메시지가 없으면 예외 클래스 이름
     */
    static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }

    private static Throwable nextCause(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
