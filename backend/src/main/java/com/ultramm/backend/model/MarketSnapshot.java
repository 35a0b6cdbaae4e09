package com.ultramm.backend.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Latest known state of one symbol. Instances are immutable and replaced as a whole on every update.
 */
public record MarketSnapshot(
        String symbol,
        double bestBid,
        double bestAsk,
        List<DepthLevel> bids,
        List<DepthLevel> asks,
        double lastPrice,
        double lastSize,
        Instant timestamp
) {

    public MarketSnapshot {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public boolean hasBook() {
        return bestBid > 0 && bestAsk > 0;
    }

    /**
     * Average of best bid and best ask, falling back to the last trade price when the book is empty.
     */
    public double midPrice() {
        if (hasBook()) {
            return (bestBid + bestAsk) / 2.0;
        }
        return lastPrice;
    }

    public double spread() {
        return hasBook() ? bestAsk - bestBid : 0.0;
    }

    public double spreadPercent() {
        double mid = midPrice();
        return mid > 0 ? spread() / mid * 100.0 : 0.0;
    }

    /**
     * Quantity-weighted average price over the top {@code levels} bid and ask levels.
     */
    public double depthWeightedMid(int levels) {
        double notional = 0.0;
        double quantity = 0.0;
        for (int i = 0; i < Math.min(levels, bids.size()); i++) {
            notional += bids.get(i).price() * bids.get(i).quantity();
            quantity += bids.get(i).quantity();
        }
        for (int i = 0; i < Math.min(levels, asks.size()); i++) {
            notional += asks.get(i).price() * asks.get(i).quantity();
            quantity += asks.get(i).quantity();
        }
        return quantity > 0 ? notional / quantity : midPrice();
    }

    public double depthQuantity(int levels) {
        double quantity = 0.0;
        for (int i = 0; i < Math.min(levels, bids.size()); i++) {
            quantity += bids.get(i).quantity();
        }
        for (int i = 0; i < Math.min(levels, asks.size()); i++) {
            quantity += asks.get(i).quantity();
        }
        return quantity;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(timestamp, now);
    }
}
