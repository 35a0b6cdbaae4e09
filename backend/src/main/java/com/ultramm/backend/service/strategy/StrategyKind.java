package com.ultramm.backend.service.strategy;

public enum StrategyKind {
    MARKET_MAKING,
    ADAPTIVE_MARKET_MAKING,
    STATISTICAL_ARBITRAGE;

    public boolean isPairStrategy() {
        return this == STATISTICAL_ARBITRAGE;
    }
}
