package com.linlay.archinsight.llm.retry;

import java.time.Duration;
import java.util.List;

/**
 * Immutable retry settings for one call.
 *
 * @param maxRetries        retries after the first attempt; {@code 0} runs the operation once
 * @param initialDelay      sleep before the first retry
 * @param maxDelay          cap applied to every grown delay
 * @param backoffMultiplier factor applied to the delay after each retry, greater than 1
 * @param retryableErrors   substrings matched case-insensitively against message, code and status
 * @param observer          optional hook called before each sleep
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double backoffMultiplier,
        List<String> retryableErrors,
        RetryObserver observer
) {

    public static final List<String> DEFAULT_RETRYABLE_ERRORS = List.of(
            "rate_limit",
            "rate limit",
            "too_many_requests",
            "timeout",
            "network",
            "ECONNRESET",
            "ETIMEDOUT",
            "ENOTFOUND",
            "temporary",
            "429",
            "500",
            "502",
            "503"
    );

    public static final RetryPolicy DEFAULT = builder().build();

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (!(backoffMultiplier > 1.0d)) {
            throw new IllegalArgumentException("backoffMultiplier must be > 1");
        }
        retryableErrors = retryableErrors == null ? List.of() : retryableErrors.stream()
                .filter(pattern -> pattern != null && !pattern.isBlank())
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy withObserver(RetryObserver nextObserver) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffMultiplier, retryableErrors, nextObserver);
    }

    Duration nextDelay(Duration current) {
        long grown = (long) Math.min((double) Long.MAX_VALUE, current.toMillis() * backoffMultiplier);
        return Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0d;
        private List<String> retryableErrors = DEFAULT_RETRYABLE_ERRORS;
        private RetryObserver observer;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder retryableErrors(List<String> retryableErrors) {
            this.retryableErrors = retryableErrors == null ? List.of() : List.copyOf(retryableErrors);
            return this;
        }

        public Builder observer(RetryObserver observer) {
            this.observer = observer;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffMultiplier, retryableErrors, observer);
        }
    }
}
