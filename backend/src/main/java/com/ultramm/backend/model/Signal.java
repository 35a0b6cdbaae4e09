package com.ultramm.backend.model;

/**
 * Proposal produced by one strategy for one symbol.
 * Quote signals carry both prices; directional signals carry the limit price of their side.
 *
 * @param referencePrice mid price the strategy saw when it produced the signal
 * @param confidence     in [0, 1]
 * @param exit           true when the signal only reduces an existing position
 */
public record Signal(
        String strategyId,
        String symbol,
        SignalSide side,
        double bidPrice,
        double askPrice,
        double size,
        double confidence,
        double referencePrice,
        boolean exit,
        String reason
) {

    public static Signal quote(String strategyId, String symbol, double bidPrice, double askPrice, double size,
                               double confidence, double referencePrice, String reason) {
        return new Signal(strategyId, symbol, SignalSide.QUOTE, bidPrice, askPrice, size, confidence,
                referencePrice, false, reason);
    }

    public static Signal directional(String strategyId, String symbol, Side side, double price, double size,
                                     double confidence, double referencePrice, boolean exit, String reason) {
        double bid = side == Side.BUY ? price : 0.0;
        double ask = side == Side.SELL ? price : 0.0;
        return new Signal(strategyId, symbol, SignalSide.of(side), bid, ask, size, confidence,
                referencePrice, exit, reason);
    }

    /**
     * Limit price for directional signals.
     */
    public double limitPrice() {
        return switch (side) {
            case BUY -> bidPrice;
            case SELL -> askPrice;
            default -> referencePrice;
        };
    }

    public int direction() {
        return switch (side) {
            case BUY -> 1;
            case SELL -> -1;
            default -> 0;
        };
    }
}
