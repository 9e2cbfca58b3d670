package com.linlay.archinsight.llm.retry;

import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.OrchestrationCancelledException;
import com.linlay.archinsight.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs an operation, retrying transient failures with capped exponential backoff.
 * <p>
 * Non-retryable failures propagate on the spot. When retries run out the failure of the last
 * attempt propagates unchanged, so callers always see the real cause.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.SYSTEM);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public <T> T executeWithRetry(Supplier<T> operation, RetryPolicy policy) {
        return executeWithRetryAndCount(operation, policy, CancellationToken.none()).result();
    }

    public <T> T executeWithRetry(Supplier<T> operation, RetryPolicy policy, CancellationToken cancellation) {
        return executeWithRetryAndCount(operation, policy, cancellation).result();
    }

    public <T> RetryOutcome<T> executeWithRetryAndCount(
            Supplier<T> operation,
            RetryPolicy policy,
            CancellationToken cancellation
    ) {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        RetryPolicy effective = policy == null ? RetryPolicy.DEFAULT : policy;
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        Duration delay = effective.initialDelay();

        for (int attempt = 1; ; attempt++) {
            try {
                return new RetryOutcome<>(operation.get(), attempt);
            } catch (OrchestrationCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                if (!RetryableErrorClassifier.isRetryable(ex, effective.retryableErrors())) {
                    log.debug("Attempt {} failed with non-retryable error: {}", attempt, ex.getMessage());
                    throw ex;
                }
                if (attempt > effective.maxRetries()) {
                    if (effective.maxRetries() > 0) {
                        log.warn("Retries exhausted after {} attempts: {}", attempt, ex.getMessage());
                    }
                    throw ex;
                }
                if (effective.observer() != null) {
                    effective.observer().onRetry(attempt, ex);
                }
                log.warn("Retry attempt {}/{} after {}ms. Error: {}",
                        attempt, effective.maxRetries(), delay.toMillis(), ex.getMessage());
                token.sleep(sleeper, delay, "retry attempt " + (attempt + 1));
                delay = effective.nextDelay(delay);
            }
        }
    }

    public record RetryOutcome<T>(T result, int attempts) {
    }
}
