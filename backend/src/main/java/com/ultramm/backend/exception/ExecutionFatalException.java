package com.ultramm.backend.exception;

/**
 * Exchange call failed permanently (authentication, account disabled). Halts the exchange.
 */
public class ExecutionFatalException extends TradingException {

    private final String exchangeId;

    public ExecutionFatalException(String exchangeId, String message) {
        super(message);
        this.exchangeId = exchangeId;
    }

    public ExecutionFatalException(String exchangeId, String message, Throwable cause) {
        super(message, cause);
        this.exchangeId = exchangeId;
    }

    public String getExchangeId() {
        return exchangeId;
    }

    @Override
    public String getErrorCode() {
        return "EXECUTION_FATAL";
    }
}
