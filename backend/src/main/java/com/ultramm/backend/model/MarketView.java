package com.ultramm.backend.model;

public record MarketView(
        MarketSnapshot snapshot,
        IndicatorSet indicators
) {

    public String symbol() {
        return snapshot.symbol();
    }

    public double midPrice() {
        return snapshot.midPrice();
    }
}
