package com.ultramm.backend.exception;

/**
 * Market data for a symbol is missing or older than the configured cache expiry.
 */
public class DataStaleException extends TradingException {

    private final String symbol;

    public DataStaleException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String getErrorCode() {
        return "DATA_STALE";
    }
}
