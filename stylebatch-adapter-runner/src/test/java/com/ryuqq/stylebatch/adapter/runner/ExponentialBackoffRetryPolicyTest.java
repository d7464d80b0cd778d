package com.ryuqq.stylebatch.adapter.runner;

import com.ryuqq.stylebatch.application.orchestrator.BatchConfig;
import com.ryuqq.stylebatch.core.failure.FailureClass;
import com.ryuqq.stylebatch.core.failure.GenerationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExponentialBackoffRetryPolicy 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExponentialBackoffRetryPolicyTest {

    private final ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    @Test
    @DisplayName("기본 백오프는 1초, 2초, 4초로 증가")
    void 지수_백오프() {
        assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("백오프는 maxBackoff를 넘지 않으며 큰 시도 번호에서도 overflow 없음")
    void 백오프_상한() {
        // given
        ExponentialBackoffRetryPolicy capped =
            new ExponentialBackoffRetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(30));

        // then
        assertThat(capped.backoffFor(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(capped.backoffFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(capped.backoffFor(62)).isEqualTo(Duration.ofSeconds(30));
        assertThat(capped.backoffFor(1000)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("TRANSIENT 오류만, 남은 시도가 있을 때만 재시도")
    void 재시도_판단() {
        GenerationError transientError = GenerationError.transientError("503");

        assertThat(policy.shouldRetry(transientError, 0)).isTrue();
        assertThat(policy.shouldRetry(transientError, 1)).isTrue();
        assertThat(policy.shouldRetry(transientError, 2)).isFalse();
        assertThat(policy.shouldRetry(GenerationError.permanent("invalid"), 0)).isFalse();
        assertThat(policy.shouldRetry(new GenerationError(FailureClass.CANCELLED, "cancelled"), 0)).isFalse();
        assertThat(policy.shouldRetry(null, 0)).isFalse();
    }

    @Test
    @DisplayName("BatchConfig에서 생성")
    void from_BatchConfig() {
        // given
        BatchConfig config = new BatchConfig()
            .withMaxAttempts(5)
            .withBaseBackoff(Duration.ofMillis(200))
            .withMaxBackoff(Duration.ofSeconds(3));

        // when
        ExponentialBackoffRetryPolicy fromConfig = ExponentialBackoffRetryPolicy.from(config);

        // then
        assertThat(fromConfig.maxAttempts()).isEqualTo(5);
        assertThat(fromConfig.getBaseBackoff()).isEqualTo(Duration.ofMillis(200));
        assertThat(fromConfig.getMaxBackoff()).isEqualTo(Duration.ofSeconds(3));
        assertThat(fromConfig.backoffFor(2)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    @DisplayName("잘못된 인자는 예외")
    void 잘못된_인자() {
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts must be positive");
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.backoffFor(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExponentialBackoffRetryPolicy.from(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
