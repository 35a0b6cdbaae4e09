package com.ultramm.backend.model;

/**
 * Immutable view of a symbol's net position. Each applied fill produces a new snapshot with
 * a higher version.
 *
 * @param quantity          signed net quantity, positive when long
 * @param averageEntryPrice average price of the open quantity, zero when flat
 * @param realizedPnl       realized profit net of fees
 */
public record PositionSnapshot(
        String symbol,
        double quantity,
        double averageEntryPrice,
        double realizedPnl,
        double fees,
        long version
) {

    private static final double EPSILON = 1e-12;

    public static PositionSnapshot flat(String symbol) {
        return new PositionSnapshot(symbol, 0.0, 0.0, 0.0, 0.0, 0L);
    }

    public boolean isFlat() {
        return Math.abs(quantity) <= EPSILON;
    }

    public double unrealizedPnl(double markPrice) {
        if (isFlat() || markPrice <= 0) {
            return 0.0;
        }
        return (markPrice - averageEntryPrice) * quantity;
    }

    /**
     * Profit of the open quantity relative to its entry price, in percent.
     */
    public double unrealizedPnlPercent(double markPrice) {
        if (isFlat() || averageEntryPrice <= 0 || markPrice <= 0) {
            return 0.0;
        }
        return (markPrice - averageEntryPrice) / averageEntryPrice * 100.0 * Math.signum(quantity);
    }

    public PositionSnapshot applyFill(Side side, double fillQuantity, double fillPrice, double fee) {
        double signed = side.sign() * fillQuantity;
        double newQuantity = quantity + signed;
        double newAverage = averageEntryPrice;
        double newRealized = realizedPnl - fee;

        if (isFlat() || quantity * signed > 0) {
            newAverage = (Math.abs(quantity) * averageEntryPrice + fillQuantity * fillPrice) / Math.abs(newQuantity);
        } else {
            double closing = Math.min(Math.abs(signed), Math.abs(quantity));
            newRealized += closing * (fillPrice - averageEntryPrice) * Math.signum(quantity);
            if (Math.abs(newQuantity) <= EPSILON) {
                newQuantity = 0.0;
                newAverage = 0.0;
            } else if (Math.signum(newQuantity) != Math.signum(quantity)) {
                newAverage = fillPrice;
            }
        }
        return new PositionSnapshot(symbol, newQuantity, newAverage, newRealized, fees + fee, version + 1);
    }
}
