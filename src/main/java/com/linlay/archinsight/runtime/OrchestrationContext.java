package com.linlay.archinsight.runtime;

import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifetime-scoped state of one orchestration run. Every component of the run receives this
 * object instead of reaching for process-wide counters.
 */
public class OrchestrationContext {

    private final String runId;
    private final String provider;
    private final CancellationToken cancellation;
    private final Clock clock;
    private final Instant startedAt;

    private final AtomicInteger modelCalls = new AtomicInteger();
    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicInteger toolRequests = new AtomicInteger();
    private final AtomicInteger iterations = new AtomicInteger();

    public OrchestrationContext(String provider, CancellationToken cancellation) {
        this(RunIdGenerator.nextRunId(), provider, cancellation, Clock.systemUTC());
    }

    public OrchestrationContext(String runId, String provider, CancellationToken cancellation, Clock clock) {
        if (!StringUtils.hasText(provider)) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        this.runId = StringUtils.hasText(runId) ? runId.trim() : RunIdGenerator.nextRunId();
        this.provider = provider.trim();
        this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
    }

    public String runId() {
        return runId;
    }

    public String provider() {
        return provider;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public void incrementModelCalls() {
        modelCalls.incrementAndGet();
    }

    public void incrementRetries() {
        retries.incrementAndGet();
    }

    public void incrementToolRequests(int count) {
        toolRequests.addAndGet(Math.max(0, count));
    }

    public void incrementIterations() {
        iterations.incrementAndGet();
    }

    public int modelCalls() {
        return modelCalls.get();
    }

    public int retries() {
        return retries.get();
    }

    public int toolRequests() {
        return toolRequests.get();
    }

    public int iterations() {
        return iterations.get();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public RunStats snapshot() {
        return new RunStats(runId, provider, iterations(), modelCalls(), retries(), toolRequests(), elapsed().toMillis());
    }

    public record RunStats(
            String runId,
            String provider,
            int iterations,
            int modelCalls,
            int retries,
            int toolRequests,
            long elapsedMs
    ) {
    }
}
