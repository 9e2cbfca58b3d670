package com.linlay.archinsight.llm.retry;

/**
 * Notified before each backoff sleep. Allows progress reporting without coupling the executor to
 * a particular monitoring system.
 */
@FunctionalInterface
public interface RetryObserver {

    /**
     * @param attempt the 1-based number of the attempt that just failed
     * @param error   the retryable failure of that attempt
     */
    void onRetry(int attempt, RuntimeException error);
}
