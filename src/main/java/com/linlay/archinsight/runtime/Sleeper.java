package com.linlay.archinsight.runtime;

import java.time.Duration;

/**
 * Suspension point used by backoff and rate-limit waits. Tests replace it to observe delays
 * without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
