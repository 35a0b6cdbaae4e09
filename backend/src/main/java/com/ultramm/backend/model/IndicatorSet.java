package com.ultramm.backend.model;

/**
 * Rolling statistics derived from a symbol's bounded candle window.
 *
 * @param volatility     standard deviation of candle close returns, in percent
 * @param volatilityRatio current volatility relative to its long-run baseline
 * @param volumeRatio    volume of the forming candle relative to the average closed candle
 * @param trend          short moving average minus long moving average, in price units
 * @param liquidityScore top-of-book depth relative to its baseline
 * @param spreadRatio    current bid/ask spread relative to its baseline
 * @param meanReversion  negated deviation of price from its short average, clamped to [-1, 1]
 * @param candles        number of closed candles in the window
 */
public record IndicatorSet(
        double volatility,
        double volatilityRatio,
        double volumeRatio,
        double trend,
        double liquidityScore,
        double spreadRatio,
        double meanReversion,
        int candles
) {

    public static final IndicatorSet NEUTRAL = new IndicatorSet(0.0, 1.0, 1.0, 0.0, 1.0, 1.0, 0.0, 0);
}
