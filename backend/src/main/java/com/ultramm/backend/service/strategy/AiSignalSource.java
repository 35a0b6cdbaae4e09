package com.ultramm.backend.service.strategy;

/**
 * Optional external scorer consulted by the adaptive strategy.
 * Features are volatility, volume ratio, spread ratio, trend (percent of mid) and liquidity score.
 */
@FunctionalInterface
public interface AiSignalSource {

    /**
     * @return a score in [-1, 1]; positive widens the quoted spread, negative tightens it
     */
    double score(String symbol, double[] features);
}
