package com.linlay.archinsight.conversation;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Progress observers of the iteration loop. They cannot influence control flow.
 */
public interface IterationCallbacks {

    IterationCallbacks NONE = new IterationCallbacks() {
    };

    default void onIterationStart(int iteration, int maxIterations) {
    }

    default void onIterationComplete(ObjectNode result, int iteration, int maxIterations) {
    }
}
