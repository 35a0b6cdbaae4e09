package com.ultramm.backend.model;

import java.time.Instant;
import java.util.Map;

/**
 * Weighted consensus of the strategy signals for one symbol on one tick.
 */
public record CombinedSignal(
        String symbol,
        SignalSide side,
        double bidPrice,
        double askPrice,
        double size,
        double confidence,
        double referencePrice,
        boolean exit,
        String leadStrategyId,
        Map<String, Double> weights,
        Instant createdAt
) {

    public CombinedSignal {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    /**
     * No strategy wants to act. Still flows through risk so protective exits can fire.
     */
    public static CombinedSignal hold(String symbol, double referencePrice, Instant createdAt) {
        return new CombinedSignal(symbol, SignalSide.HOLD, 0.0, 0.0, 0.0, 0.0, referencePrice, false,
                null, Map.of(), createdAt);
    }

    public boolean isHold() {
        return side == SignalSide.HOLD;
    }

    public double limitPrice() {
        return switch (side) {
            case BUY -> bidPrice;
            case SELL -> askPrice;
            default -> referencePrice;
        };
    }
}
