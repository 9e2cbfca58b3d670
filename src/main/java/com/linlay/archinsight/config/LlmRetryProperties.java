package com.linlay.archinsight.config;

import com.linlay.archinsight.llm.retry.RetryPolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "insight.llm.retry")
public class LlmRetryProperties {

    @Min(0)
    private int maxRetries = 3;
    @NotNull
    private Duration initialDelay = Duration.ofSeconds(1);
    @NotNull
    private Duration maxDelay = Duration.ofSeconds(30);
    @DecimalMin(value = "1.0", inclusive = false)
    private double backoffMultiplier = 2.0d;
    private List<String> retryableErrors = new ArrayList<>(RetryPolicy.DEFAULT_RETRYABLE_ERRORS);

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public List<String> getRetryableErrors() {
        return retryableErrors;
    }

    public void setRetryableErrors(List<String> retryableErrors) {
        this.retryableErrors = retryableErrors == null ? new ArrayList<>() : new ArrayList<>(retryableErrors);
    }

    public RetryPolicy toPolicy() {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .retryableErrors(retryableErrors)
                .build();
    }
}
