package com.linlay.archinsight.llm.ratelimit;

import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sliding-window limiter keyed by provider name. A timestamp counts while it is strictly newer
 * than {@code now - window}, so a slot frees up exactly one window after the request that took it.
 * <p>
 * All history access is serialized on this instance. {@link #acquire} checks and records under
 * one lock; callers using the separate {@link #canMakeRequest}/{@link #recordRequest} pair get the
 * best-effort behaviour of two independent calls.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    public static final Duration DEFAULT_BUFFER = Duration.ofMillis(100);

    private final Map<String, RateLimitConfig> configs = new HashMap<>();
    private final Map<String, Deque<Long>> history = new HashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration buffer;

    public RateLimiter() {
        this(Clock.systemUTC(), Sleeper.SYSTEM, DEFAULT_BUFFER);
    }

    public RateLimiter(Clock clock, Sleeper sleeper, Duration buffer) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.buffer = buffer == null || buffer.isNegative() ? DEFAULT_BUFFER : buffer;
    }

    public static RateLimiter withDefaults(Clock clock, Sleeper sleeper, Duration buffer) {
        RateLimiter limiter = new RateLimiter(clock, sleeper, buffer);
        limiter.configure("openai", RateLimitConfig.perMinute(60));
        limiter.configure("claude", RateLimitConfig.perMinute(50));
        return limiter;
    }

    public synchronized void configure(String provider, RateLimitConfig config) {
        if (provider == null || config == null) {
            throw new IllegalArgumentException("provider and config must not be null");
        }
        configs.put(provider, config);
    }

    public synchronized Optional<RateLimitConfig> config(String provider) {
        return Optional.ofNullable(configs.get(provider));
    }

    public synchronized boolean canMakeRequest(String provider) {
        RateLimitConfig config = configs.get(provider);
        if (config == null) {
            return true;
        }
        return prune(provider, config, now()).size() < config.maxRequests();
    }

    /**
     * Records a request against the provider's window. Unlimited providers keep no history.
     */
    public synchronized void recordRequest(String provider) {
        RateLimitConfig config = configs.get(provider);
        if (config == null) {
            return;
        }
        long now = now();
        prune(provider, config, now);
        history.computeIfAbsent(provider, ignored -> new ArrayDeque<>()).addLast(now);
    }

    /**
     * Sleeps once until the oldest in-window request leaves the window, plus a small buffer.
     * Returns without re-checking; another caller may have taken the slot meanwhile. Use
     * {@link #acquire} when the slot has to be guaranteed.
     */
    public void waitUntilAvailable(String provider) {
        waitUntilAvailable(provider, CancellationToken.none());
    }

    public void waitUntilAvailable(String provider, CancellationToken cancellation) {
        Duration wait = requiredWait(provider);
        if (wait.isZero()) {
            return;
        }
        log.info("Rate limit reached for {}. Waiting {}ms...", provider, wait.toMillis());
        cancellationOf(cancellation).sleep(sleeper, wait, "rate limit wait for " + provider);
    }

    /**
     * Waits until a slot is free and records the request in the same critical section as the
     * final check, looping when a concurrent caller wins the freed slot.
     */
    public void acquire(String provider, CancellationToken cancellation) {
        CancellationToken token = cancellationOf(cancellation);
        while (true) {
            Duration wait;
            synchronized (this) {
                if (canMakeRequest(provider)) {
                    recordRequest(provider);
                    return;
                }
                wait = requiredWait(provider);
            }
            if (!wait.isZero()) {
                log.info("Rate limit reached for {}. Waiting {}ms...", provider, wait.toMillis());
                token.sleep(sleeper, wait, "rate limit wait for " + provider);
            } else {
                token.throwIfCancelled("rate limit wait for " + provider);
            }
        }
    }

    public synchronized int getRequestCount(String provider) {
        RateLimitConfig config = configs.get(provider);
        if (config == null) {
            return 0;
        }
        return prune(provider, config, now()).size();
    }

    public synchronized void clearHistory(String provider) {
        if (provider == null) {
            history.clear();
        } else {
            history.remove(provider);
        }
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    synchronized int retainedTimestamps(String provider) {
        Deque<Long> timestamps = history.get(provider);
        return timestamps == null ? 0 : timestamps.size();
    }

    synchronized Duration requiredWait(String provider) {
        RateLimitConfig config = configs.get(provider);
        if (config == null) {
            return Duration.ZERO;
        }
        long now = now();
        Deque<Long> recent = prune(provider, config, now);
        if (recent.size() < config.maxRequests() || recent.isEmpty()) {
            return Duration.ZERO;
        }
        long oldest = recent.stream().mapToLong(Long::longValue).min().orElse(now);
        long waitMs = (oldest + config.window().toMillis()) - now + buffer.toMillis();
        return waitMs > 0 ? Duration.ofMillis(waitMs) : Duration.ZERO;
    }

    private Deque<Long> prune(String provider, RateLimitConfig config, long now) {
        Deque<Long> timestamps = history.get(provider);
        if (timestamps == null) {
            return new ArrayDeque<>();
        }
        long windowStart = now - config.window().toMillis();
        timestamps.removeIf(timestamp -> timestamp <= windowStart);
        return timestamps;
    }

    private long now() {
        return clock.millis();
    }

    private CancellationToken cancellationOf(CancellationToken cancellation) {
        return cancellation == null ? CancellationToken.none() : cancellation;
    }
}
