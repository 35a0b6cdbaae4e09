package com.ultramm.backend.service.strategy;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.config.MarketsProperties;
import com.ultramm.backend.config.StrategyProperties;
import com.ultramm.backend.exception.ConfigValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyRegistryFactoryTest {

    private final StrategyRegistryFactory factory = new StrategyRegistryFactory(new StrategyProperties(),
            new MarketsProperties(), new DataProperties());

    @Test
    void buildsEveryConfiguredStrategyInOrder() {
        StrategyRegistry registry = factory.create(List.of(
                definition("basic-mm", StrategyKind.MARKET_MAKING, "BTC/USDT", "ETH/USDT"),
                definition("adaptive-mm", StrategyKind.ADAPTIVE_MARKET_MAKING, "BTC/USDT"),
                pair("stat-arb", "BTC/USDT", "SOL/USDT")), null);

        assertThat(registry.all()).extracting(TradingStrategy::id).containsExactly("basic-mm", "adaptive-mm", "stat-arb");
        assertThat(registry.all().get(1)).isInstanceOf(AdaptiveMarketMakingStrategy.class);
        assertThat(registry.symbolStrategies("BTC/USDT")).hasSize(2);
        assertThat(registry.evaluatedSymbols()).containsExactly("BTC/USDT", "ETH/USDT");
        assertThat(registry.tradedSymbols()).containsExactly("BTC/USDT", "ETH/USDT", "SOL/USDT");
        assertThat(registry.strategyIdsFor("SOL/USDT")).containsExactly("stat-arb");
        assertThat(registry.registrationIndex("adaptive-mm")).isEqualTo(1);
    }

    @Test
    void reportsEveryProblemAtOnce() {
        StrategyProperties.Definition badSpread = definition("tight", StrategyKind.MARKET_MAKING, "BTC/USDT");
        badSpread.getMarketMaking().setMaxPosition(0.001);
        StrategyProperties.Definition badPair = pair("stat-arb", "BTC/USDT", "BTC/USDT");
        badPair.getStatisticalArbitrage().setExitThreshold(3.0);

        assertThatThrownBy(() -> factory.create(List.of(
                definition("basic-mm", StrategyKind.MARKET_MAKING, "DOGE/USDT"),
                definition("basic-mm", StrategyKind.MARKET_MAKING, "BTC/USDT"),
                badSpread,
                badPair), null))
                .isInstanceOfSatisfying(ConfigValidationException.class, e -> assertThat(e.getProblems()).containsExactly(
                        "basic-mm: unknown symbol DOGE/USDT",
                        "duplicate strategy id 'basic-mm'",
                        "tight: max position is smaller than the order size",
                        "stat-arb: a pair needs two distinct symbols, got [BTC/USDT, BTC/USDT]",
                        "stat-arb: exit z-score must be below the entry threshold"));
    }

    @Test
    void adaptiveBoundsMustBeOrdered() {
        StrategyProperties.Definition adaptive = definition("adaptive-mm", StrategyKind.ADAPTIVE_MARKET_MAKING, "BTC/USDT");
        adaptive.getAdaptive().setMinSpreadMultiplier(4.0);

        assertThatThrownBy(() -> factory.create(List.of(adaptive), null))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("min spread multiplier exceeds max");
    }

    private static StrategyProperties.Definition definition(String id, StrategyKind kind, String... symbols) {
        StrategyProperties.Definition definition = new StrategyProperties.Definition();
        definition.setId(id);
        definition.setType(kind);
        definition.setSymbols(List.of(symbols));
        return definition;
    }

    private static StrategyProperties.Definition pair(String id, String first, String second) {
        StrategyProperties.Definition definition = new StrategyProperties.Definition();
        definition.setId(id);
        definition.setType(StrategyKind.STATISTICAL_ARBITRAGE);
        definition.setSymbolPairs(List.of(List.of(first, second)));
        return definition;
    }
}
