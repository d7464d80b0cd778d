package com.ryuqq.stylebatch.core.failure;

/**
 * 생성 실패 분류.
 *
 * <p>재시도 여부는 이 분류로만 결정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureClass {

    /**
     * 일시적 실패 (재시도 가능).
     *
     * <p>예: 503 Service Unavailable, 429 Too Many Requests, quota 소진, 서버 과부하</p>
     */
    TRANSIENT,

    /**
     * 영구적 실패 (재시도 불가).
     *
     * <p>예: 잘못된 입력, 인증 오류, 콘텐츠 정책 거부, 이미지 없이 텍스트만 반환</p>
     */
    PERMANENT,

    /**
     * 배치 데드라인 또는 종료 요청으로 중단됨.
     */
    CANCELLED;

    /**
     * 재시도 가능한 분류인지 확인.
     *
     * @return TRANSIENT인 경우 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
