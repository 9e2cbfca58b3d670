package com.linlay.archinsight.insight;

import com.linlay.archinsight.runtime.CancellationToken;
import org.springframework.util.StringUtils;

/**
 * @param provider      gateway and rate-limit key, for example {@code openai}
 * @param prompt        first user turn of the conversation
 * @param maxIterations iteration bound; {@code 0} uses the configured default
 * @param cancellation  signal observed at every suspension point of the run
 */
public record InsightRequest(
        String provider,
        String prompt,
        int maxIterations,
        CancellationToken cancellation
) {

    public InsightRequest {
        if (!StringUtils.hasText(provider)) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (maxIterations < 0) {
            maxIterations = 0;
        }
        if (cancellation == null) {
            cancellation = CancellationToken.none();
        }
    }

    public InsightRequest(String provider, String prompt) {
        this(provider, prompt, 0, null);
    }
}
