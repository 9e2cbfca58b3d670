package com.linlay.archinsight.config;

import com.linlay.archinsight.conversation.ConversationOrchestrator;
import com.linlay.archinsight.conversation.ToolRequest;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "insight.loop")
public record InsightLoopProperties(
        int maxIterations,
        int maxRequestsPerIteration,
        String continuationPrompt,
        int maxFileChars,
        int defaultGrepResults
) {

    public InsightLoopProperties {
        if (maxIterations <= 0) {
            maxIterations = 3;
        }
        if (maxRequestsPerIteration <= 0) {
            maxRequestsPerIteration = ConversationOrchestrator.DEFAULT_MAX_REQUESTS_PER_ITERATION;
        }
        if (!StringUtils.hasText(continuationPrompt)) {
            continuationPrompt = ConversationOrchestrator.DEFAULT_CONTINUATION_PROMPT;
        }
        if (maxFileChars <= 0) {
            maxFileChars = 5000;
        }
        if (defaultGrepResults <= 0) {
            defaultGrepResults = ToolRequest.DEFAULT_GREP_RESULTS;
        }
    }
}
