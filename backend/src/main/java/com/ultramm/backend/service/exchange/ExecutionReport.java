package com.ultramm.backend.service.exchange;

import java.time.Instant;

/**
 * Asynchronous order update from an exchange. Fill reports carry the incremental quantity.
 */
public record ExecutionReport(
        Type type,
        String clientOrderId,
        String exchangeOrderId,
        String symbol,
        double lastQuantity,
        double lastPrice,
        String reason,
        Instant timestamp
) {

    public enum Type {
        ACK,
        PARTIAL_FILL,
        FILL,
        CANCELED,
        REJECTED,
        EXPIRED
    }

    public boolean isFill() {
        return type == Type.PARTIAL_FILL || type == Type.FILL;
    }
}
