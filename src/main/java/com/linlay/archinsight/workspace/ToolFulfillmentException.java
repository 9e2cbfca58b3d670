package com.linlay.archinsight.workspace;

public class ToolFulfillmentException extends RuntimeException {

    public ToolFulfillmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
