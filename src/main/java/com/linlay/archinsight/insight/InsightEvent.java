package com.linlay.archinsight.insight;

import com.linlay.archinsight.runtime.OrchestrationContext;

/**
 * Progress of a streamed insight run. Exactly one {@link Type#COMPLETED} event ends a successful
 * stream; failures end it with an error signal instead.
 */
public record InsightEvent(
        Type type,
        int iteration,
        int maxIterations,
        ArchitectureInsights insights,
        OrchestrationContext.RunStats stats
) {

    public enum Type {
        ITERATION_STARTED,
        ITERATION_COMPLETED,
        COMPLETED
    }

    public static InsightEvent iterationStarted(int iteration, int maxIterations) {
        return new InsightEvent(Type.ITERATION_STARTED, iteration, maxIterations, null, null);
    }

    public static InsightEvent iterationCompleted(int iteration, int maxIterations) {
        return new InsightEvent(Type.ITERATION_COMPLETED, iteration, maxIterations, null, null);
    }

    public static InsightEvent completed(ArchitectureInsights insights, OrchestrationContext.RunStats stats) {
        return new InsightEvent(Type.COMPLETED, stats.iterations(), stats.iterations(), insights, stats);
    }
}
