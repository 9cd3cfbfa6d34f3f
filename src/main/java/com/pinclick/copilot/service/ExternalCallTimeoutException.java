package com.pinclick.copilot.service;

public class ExternalCallTimeoutException extends RuntimeException {
    /**
     * Creates an exception naming the call that exceeded its time bound.
     */
    public ExternalCallTimeoutException(String callName, long timeoutMs, Throwable cause) {
        super(callName + " did not complete within " + timeoutMs + " ms", cause);
    }
}
