package com.ultramm.backend.exception;

/**
 * Exchange call failed in a way that may succeed on retry (timeout, connectivity, rate limit).
 */
public class ExecutionTransientException extends TradingException {
    public ExecutionTransientException(String message) {
        super(message);
    }

    public ExecutionTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "EXECUTION_TRANSIENT";
    }
}
