package com.ultramm.backend.service.strategy;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.config.MarketsProperties;
import com.ultramm.backend.config.StrategyProperties;
import com.ultramm.backend.exception.ConfigValidationException;
import com.ultramm.backend.model.PairKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link StrategyRegistry} from configuration. Every problem found is reported
 * together and the context fails to start.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class StrategyRegistryFactory {

    private final StrategyProperties strategyProperties;
    private final MarketsProperties marketsProperties;
    private final DataProperties dataProperties;

    @Bean
    public StrategyRegistry strategyRegistry(ObjectProvider<AiSignalSource> aiSignalSource) {
        StrategyRegistry registry = create(strategyProperties.getEnabled(), aiSignalSource.getIfAvailable());
        log.info("Registered {} strategies: {}", registry.size(),
                registry.all().stream().map(TradingStrategy::id).toList());
        return registry;
    }

    public StrategyRegistry create(List<StrategyProperties.Definition> definitions, AiSignalSource aiSignalSource) {
        List<String> problems = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Set<String> knownSymbols = new HashSet<>(marketsProperties.getSymbols());
        List<TradingStrategy> strategies = new ArrayList<>();

        for (StrategyProperties.Definition definition : definitions) {
            String id = definition.getId();
            if (id == null || id.isBlank()) {
                problems.add("strategy without id");
                continue;
            }
            if (!ids.add(id)) {
                problems.add("duplicate strategy id '" + id + "'");
                continue;
            }
            if (definition.getType() == null) {
                problems.add(id + ": missing type");
                continue;
            }
            int before = problems.size();
            if (definition.getType().isPairStrategy()) {
                List<PairKey> pairs = validatePairs(definition, knownSymbols, problems);
                validateStatArb(id, definition.getStatisticalArbitrage(), problems);
                if (problems.size() == before) {
                    strategies.add(new StatisticalArbitrageStrategy(id, pairs, statArbParameters(definition)));
                }
            } else {
                validateSymbols(definition, knownSymbols, problems);
                validateMarketMaking(id, definition.getMarketMaking(), problems);
                if (definition.getType() == StrategyKind.ADAPTIVE_MARKET_MAKING) {
                    validateAdaptive(id, definition.getAdaptive(), problems);
                }
                if (problems.size() == before) {
                    strategies.add(symbolStrategy(definition, aiSignalSource));
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        return new StrategyRegistry(strategies);
    }

    private SymbolStrategy symbolStrategy(StrategyProperties.Definition definition, AiSignalSource aiSignalSource) {
        StrategyProperties.MarketMaking mm = definition.getMarketMaking();
        BasicMarketMakingStrategy.Parameters parameters = new BasicMarketMakingStrategy.Parameters(
                mm.getSpreadBid(), mm.getSpreadAsk(), mm.getMinProfit(), mm.getOrderSize(), mm.getMaxPosition(),
                mm.getRefreshRate());
        if (definition.getType() == StrategyKind.MARKET_MAKING) {
            return new BasicMarketMakingStrategy(definition.getId(), definition.getSymbols(), parameters);
        }
        StrategyProperties.Adaptive a = definition.getAdaptive();
        AdaptiveMarketMakingStrategy.AdaptiveParameters adaptive = new AdaptiveMarketMakingStrategy.AdaptiveParameters(
                a.getVolatilityFactor(), a.getVolumeFactor(), a.getTrendFactor(), a.getLiquidityFactor(),
                a.getMeanReversionFactor(), a.getAiWeight(), a.getMinSpreadMultiplier(), a.getMaxSpreadMultiplier(),
                a.getMinSizeMultiplier(), a.getMaxSizeMultiplier(), a.getMinSpreadPercent(), a.getMaxSpreadPercent());
        return new AdaptiveMarketMakingStrategy(definition.getId(), definition.getSymbols(), parameters, adaptive,
                aiSignalSource);
    }

    private StatisticalArbitrageStrategy.Parameters statArbParameters(StrategyProperties.Definition definition) {
        StrategyProperties.StatisticalArbitrage sa = definition.getStatisticalArbitrage();
        double tickMillis = Math.max(1L, dataProperties.getTickInterval().toMillis());
        double halfLifeTicks = Math.max(1.0, sa.getHalfLife().toMillis() / tickMillis);
        return new StatisticalArbitrageStrategy.Parameters(
                sa.getEntryThreshold(), sa.getExitThreshold(), sa.getPositionSize(), sa.getMaxPosition(),
                halfLifeTicks, sa.getWarmUpTicks(), sa.getPersistenceWindow());
    }

    private void validateSymbols(StrategyProperties.Definition definition, Set<String> knownSymbols,
                                 List<String> problems) {
        if (definition.getSymbols().isEmpty()) {
            problems.add(definition.getId() + ": no symbols configured");
        }
        for (String symbol : definition.getSymbols()) {
            if (!knownSymbols.contains(symbol)) {
                problems.add(definition.getId() + ": unknown symbol " + symbol);
            }
        }
    }

    private List<PairKey> validatePairs(StrategyProperties.Definition definition, Set<String> knownSymbols,
                                        List<String> problems) {
        List<PairKey> pairs = new ArrayList<>();
        if (definition.getSymbolPairs().isEmpty()) {
            problems.add(definition.getId() + ": no symbol pairs configured");
        }
        for (List<String> pair : definition.getSymbolPairs()) {
            if (pair.size() != 2 || pair.get(0).equals(pair.get(1))) {
                problems.add(definition.getId() + ": a pair needs two distinct symbols, got " + pair);
                continue;
            }
            for (String symbol : pair) {
                if (!knownSymbols.contains(symbol)) {
                    problems.add(definition.getId() + ": unknown symbol " + symbol);
                }
            }
            pairs.add(new PairKey(pair.get(0), pair.get(1)));
        }
        return pairs;
    }

    private void validateMarketMaking(String id, StrategyProperties.MarketMaking mm, List<String> problems) {
        if (mm.getSpreadBid() <= 0 || mm.getSpreadAsk() <= 0) {
            problems.add(id + ": spreads must be positive");
        }
        if (mm.getOrderSize() <= 0) {
            problems.add(id + ": order size must be positive");
        }
        if (mm.getMaxPosition() < mm.getOrderSize()) {
            problems.add(id + ": max position is smaller than the order size");
        }
        if (mm.getRefreshRate() == null || mm.getRefreshRate().isNegative()) {
            problems.add(id + ": refresh rate must not be negative");
        }
    }

    private void validateAdaptive(String id, StrategyProperties.Adaptive adaptive, List<String> problems) {
        if (adaptive.getMinSpreadMultiplier() > adaptive.getMaxSpreadMultiplier()) {
            problems.add(id + ": min spread multiplier exceeds max");
        }
        if (adaptive.getMinSizeMultiplier() > adaptive.getMaxSizeMultiplier()) {
            problems.add(id + ": min size multiplier exceeds max");
        }
        if (adaptive.getMinSpreadPercent() > adaptive.getMaxSpreadPercent()) {
            problems.add(id + ": min spread percent exceeds max");
        }
    }

    private void validateStatArb(String id, StrategyProperties.StatisticalArbitrage sa, List<String> problems) {
        if (sa.getEntryThreshold() <= 0) {
            problems.add(id + ": z-score threshold must be positive");
        }
        if (sa.getExitThreshold() >= sa.getEntryThreshold()) {
            problems.add(id + ": exit z-score must be below the entry threshold");
        }
        if (sa.getHalfLife() == null || sa.getHalfLife().isZero() || sa.getHalfLife().isNegative()) {
            problems.add(id + ": half-life must be positive");
        }
        if (sa.getPositionSize() <= 0) {
            problems.add(id + ": position size must be positive");
        }
    }
}
