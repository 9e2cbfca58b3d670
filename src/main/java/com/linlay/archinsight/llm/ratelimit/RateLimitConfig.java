package com.linlay.archinsight.llm.ratelimit;

import java.time.Duration;

public record RateLimitConfig(int maxRequests, Duration window) {

    public RateLimitConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitConfig perMinute(int maxRequests) {
        return new RateLimitConfig(maxRequests, Duration.ofMinutes(1));
    }
}
