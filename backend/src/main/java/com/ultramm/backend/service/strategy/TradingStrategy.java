package com.ultramm.backend.service.strategy;

/**
 * Common identity of every registered strategy instance.
 */
public interface TradingStrategy {

    String id();

    StrategyKind kind();
}
