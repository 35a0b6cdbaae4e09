package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.IndicatorSet;
import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Market maker whose spread and size scale with current conditions.
 * The spread multiplier combines volatility, volume, liquidity, trend and mean reversion
 * (and optionally an AI score), then is clamped; the resulting spread is clamped again to
 * absolute bounds.
 */
@Slf4j
public class AdaptiveMarketMakingStrategy extends BasicMarketMakingStrategy {

    public record AdaptiveParameters(
            double volatilityFactor,
            double volumeFactor,
            double trendFactor,
            double liquidityFactor,
            double meanReversionFactor,
            double aiWeight,
            double minSpreadMultiplier,
            double maxSpreadMultiplier,
            double minSizeMultiplier,
            double maxSizeMultiplier,
            double minSpreadPercent,
            double maxSpreadPercent
    ) {}

    private final AdaptiveParameters adaptive;
    private final AiSignalSource aiSignalSource;

    public AdaptiveMarketMakingStrategy(String id, List<String> symbols, Parameters parameters,
                                        AdaptiveParameters adaptive, AiSignalSource aiSignalSource) {
        super(id, symbols, parameters);
        this.adaptive = adaptive;
        this.aiSignalSource = aiSignalSource;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ADAPTIVE_MARKET_MAKING;
    }

    @Override
    public Optional<Signal> evaluate(String symbol, MarketView view, PositionSnapshot position) {
        if (atPositionLimit(symbol, position)) {
            return Optional.empty();
        }
        double mid = view.midPrice();
        if (mid <= 0) {
            return Optional.empty();
        }
        IndicatorSet indicators = view.indicators();
        double multiplier = spreadMultiplier(symbol, indicators, mid);
        double bidPercent = MathUtils.clamp(parameters.spreadBidPercent() * multiplier,
                adaptive.minSpreadPercent(), adaptive.maxSpreadPercent());
        double askPercent = MathUtils.clamp(parameters.spreadAskPercent() * multiplier,
                adaptive.minSpreadPercent(), adaptive.maxSpreadPercent());
        double size = parameters.orderSize() * sizeMultiplier(indicators);
        return Optional.of(quote(symbol, mid, bidPercent, askPercent, size,
                String.format("adaptive x%.3f", multiplier)));
    }

    double spreadMultiplier(String symbol, IndicatorSet indicators, double mid) {
        double multiplier = 1.0;
        multiplier *= Math.pow(positiveOr(indicators.volatilityRatio(), 1.0), adaptive.volatilityFactor());
        multiplier *= Math.pow(positiveOr(indicators.volumeRatio(), 1.0), adaptive.volumeFactor() / 2.0);
        multiplier *= Math.pow(positiveOr(indicators.liquidityScore(), 1.0), -adaptive.liquidityFactor());
        multiplier *= 1.0 + Math.min(1.0, Math.abs(trendPercent(indicators, mid))) * adaptive.trendFactor();
        multiplier *= 1.0 + Math.abs(indicators.meanReversion()) * adaptive.meanReversionFactor();
        multiplier *= aiAdjustment(symbol, indicators, mid);
        return MathUtils.clamp(multiplier, adaptive.minSpreadMultiplier(), adaptive.maxSpreadMultiplier());
    }

    double sizeMultiplier(IndicatorSet indicators) {
        double multiplier = Math.pow(positiveOr(indicators.volumeRatio(), 1.0), adaptive.volumeFactor());
        return MathUtils.clamp(multiplier, adaptive.minSizeMultiplier(), adaptive.maxSizeMultiplier());
    }

    private double aiAdjustment(String symbol, IndicatorSet indicators, double mid) {
        if (aiSignalSource == null || adaptive.aiWeight() <= 0) {
            return 1.0;
        }
        double[] features = {
                indicators.volatility(),
                indicators.volumeRatio(),
                indicators.spreadRatio(),
                trendPercent(indicators, mid),
                indicators.liquidityScore()
        };
        try {
            double score = MathUtils.clamp(aiSignalSource.score(symbol, features), -1.0, 1.0);
            return Math.max(0.0, 1.0 + adaptive.aiWeight() * score);
        } catch (RuntimeException e) {
            log.warn("AI score unavailable for {}, using neutral adjustment: {}", symbol, e.getMessage());
            return 1.0;
        }
    }

    private static double trendPercent(IndicatorSet indicators, double mid) {
        return mid > 0 ? indicators.trend() / mid * 100.0 : 0.0;
    }

    private static double positiveOr(double value, double fallback) {
        return MathUtils.isPositive(value) ? value : fallback;
    }
}
