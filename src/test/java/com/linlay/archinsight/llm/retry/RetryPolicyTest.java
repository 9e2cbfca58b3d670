package com.linlay.archinsight.llm.retry;

import com.linlay.archinsight.llm.LlmCallException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void defaultPolicyShouldMatchDocumentedValues() {
        RetryPolicy policy = RetryPolicy.DEFAULT;

        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.initialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffMultiplier()).isEqualTo(2.0d);
        assertThat(policy.retryableErrors()).contains("rate_limit", "ETIMEDOUT", "429", "503");
        assertThat(policy.observer()).isNull();
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().initialDelay(Duration.ofSeconds(5)).maxDelay(Duration.ofSeconds(1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().backoffMultiplier(1.0d).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankPatternsShouldBeDropped() {
        RetryPolicy policy = RetryPolicy.builder().retryableErrors(Arrays.asList("timeout", " ", "")).build();

        assertThat(policy.retryableErrors()).containsExactly("timeout");
    }

    @Test
    void nextDelayShouldBeCappedAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(250))
                .build();

        assertThat(policy.nextDelay(Duration.ofMillis(100))).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.nextDelay(Duration.ofMillis(200))).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void classifierShouldLookAtMessageCodeAndStatus() {
        List<String> patterns = RetryPolicy.DEFAULT_RETRYABLE_ERRORS;

        assertThat(RetryableErrorClassifier.isRetryable(new RuntimeException("Rate Limit hit"), patterns)).isTrue();
        assertThat(RetryableErrorClassifier.isRetryable(new LlmCallException("boom", "ETIMEDOUT", null), patterns)).isTrue();
        assertThat(RetryableErrorClassifier.isRetryable(new LlmCallException("boom", null, 502), patterns)).isTrue();
        assertThat(RetryableErrorClassifier.isRetryable(new LlmCallException("bad request", null, 400), patterns)).isFalse();
        assertThat(RetryableErrorClassifier.isRetryable(new RuntimeException((String) null), patterns)).isFalse();
    }
}
