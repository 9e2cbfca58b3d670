package com.linlay.archinsight.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-provider sliding-window limits. Entries here override the built-in openai and claude
 * defaults and may add further providers.
 */
@Validated
@ConfigurationProperties(prefix = "insight.llm.rate-limit")
public class RateLimitProperties {

    @NotNull
    private Duration buffer = Duration.ofMillis(100);
    @Valid
    private Map<String, ProviderLimit> providers = new LinkedHashMap<>();

    public Duration getBuffer() {
        return buffer;
    }

    public void setBuffer(Duration buffer) {
        this.buffer = buffer;
    }

    public Map<String, ProviderLimit> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderLimit> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(providers);
    }

    public static class ProviderLimit {
        @Min(1)
        private int maxRequests = 60;
        @NotNull
        private Duration window = Duration.ofMinutes(1);

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
