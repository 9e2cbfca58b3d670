package com.linlay.archinsight.runtime;

import java.util.concurrent.atomic.AtomicInteger;

public final class RunIdGenerator {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private RunIdGenerator() {
    }

    public static String nextRunId() {
        return encode(System.currentTimeMillis(), SEQUENCE.getAndIncrement());
    }

    static String encode(long epochMillis, int sequence) {
        long normalized = epochMillis > 0 ? epochMillis : System.currentTimeMillis();
        String suffix = Integer.toString(Math.floorMod(sequence, 1296), 36);
        return "insight_" + Long.toString(normalized, 36) + (suffix.length() == 1 ? "0" + suffix : suffix);
    }
}
