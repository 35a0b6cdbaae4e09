package com.ultramm.backend.exception;

/**
 * Base type for failures raised by the trading pipeline. The error code is surfaced to API clients.
 */
public class TradingException extends RuntimeException {

    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getErrorCode() {
        return "TRADING_ERROR";
    }
}
