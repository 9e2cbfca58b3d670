package com.linlay.archinsight.runtime;

public class OrchestrationCancelledException extends RuntimeException {

    public OrchestrationCancelledException(String message) {
        super(message);
    }

    public OrchestrationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
