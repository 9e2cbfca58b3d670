package com.linlay.archinsight.llm;

import com.linlay.archinsight.llm.ratelimit.RateLimiter;
import com.linlay.archinsight.llm.retry.RetryExecutor;
import com.linlay.archinsight.llm.retry.RetryObserver;
import com.linlay.archinsight.llm.retry.RetryPolicy;
import com.linlay.archinsight.runtime.OrchestrationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * Provider-facing wrapper of one generation call: every attempt first takes a rate-limit slot,
 * and transient failures are retried with backoff.
 */
public class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    private final LlmGatewayRegistry gateways;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public ResilientLlmCaller(
            LlmGatewayRegistry gateways,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor,
            RetryPolicy retryPolicy
    ) {
        this.gateways = gateways;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
    }

    public String call(OrchestrationContext context, List<Message> conversation) {
        LlmGateway gateway = gateways.require(context.provider());
        RetryObserver userObserver = retryPolicy.observer();
        RetryPolicy policy = retryPolicy.withObserver((attempt, error) -> {
            context.incrementRetries();
            if (userObserver != null) {
                userObserver.onRetry(attempt, error);
            }
        });

        RetryExecutor.RetryOutcome<String> outcome = retryExecutor.executeWithRetryAndCount(() -> {
            context.cancellation().throwIfCancelled("generation call");
            rateLimiter.acquire(context.provider(), context.cancellation());
            context.incrementModelCalls();
            return gateway.generate(conversation);
        }, policy, context.cancellation());

        if (outcome.attempts() > 1) {
            log.info("[insight:{}] {} call succeeded after {} attempts",
                    context.runId(), context.provider(), outcome.attempts());
        }
        return outcome.result();
    }
}
