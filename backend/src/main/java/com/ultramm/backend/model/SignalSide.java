package com.ultramm.backend.model;

/**
 * Direction proposed by a strategy.
 * QUOTE is a two-sided market-making quote, HOLD means no action this tick.
 */
public enum SignalSide {
    BUY,
    SELL,
    QUOTE,
    HOLD;

    public boolean isDirectional() {
        return this == BUY || this == SELL;
    }

    public Side toSide() {
        return switch (this) {
            case BUY -> Side.BUY;
            case SELL -> Side.SELL;
            default -> throw new IllegalStateException("No order side for " + this);
        };
    }

    public static SignalSide of(Side side) {
        return side == Side.BUY ? BUY : SELL;
    }
}
