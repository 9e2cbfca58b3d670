package com.linlay.archinsight.runtime;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal checked at every suspension point of a run: before each
 * retry sleep, before each rate-limit wait, before each generation call and before each tool
 * fulfilment.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicReference<String> reason = new AtomicReference<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel(String why) {
        if (!cancellable) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public void throwIfCancelled(String where) {
        String why = reason.get();
        if (why != null) {
            throw new OrchestrationCancelledException("Cancelled before " + where + ": " + why);
        }
    }

    /**
     * Sleeps through the given sleeper after checking the signal. An interrupted sleep is
     * reported as a cancellation with the interrupt flag restored.
     */
    public void sleep(Sleeper sleeper, Duration duration, String where) {
        throwIfCancelled(where);
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OrchestrationCancelledException("Interrupted during " + where, ex);
        }
    }
}
