package com.ultramm.backend.trading.pipeline;

import com.ultramm.backend.config.CombinerProperties;
import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.model.SignalSide;
import com.ultramm.backend.service.strategy.BasicMarketMakingStrategy;
import com.ultramm.backend.service.strategy.StrategyRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StrategyCombinerTest {

    private static final String SYMBOL = "BTC/USDT";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final StrategyRegistry registry = new StrategyRegistry(List.of(
            strategy("alpha"), strategy("beta"), strategy("gamma")));

    @Test
    void equalWeightsInitiallyAndLeadByRegistrationOrder() {
        StrategyCombiner combiner = combiner(new CombinerProperties());

        CombinedSignal combined = combiner.combine(SYMBOL, List.of(
                Signal.quote("beta", SYMBOL, 49990, 50010, 0.02, 0.5, 50000, "b"),
                Signal.quote("alpha", SYMBOL, 49980, 50020, 0.01, 0.5, 50000, "a"))).orElseThrow();

        assertThat(combined.leadStrategyId()).isEqualTo("alpha");
        assertThat(combined.side()).isEqualTo(SignalSide.QUOTE);
        assertThat(combined.bidPrice()).isCloseTo(49985, within(1e-9));
        assertThat(combined.askPrice()).isCloseTo(50015, within(1e-9));
        assertThat(combined.size()).isCloseTo(0.015, within(1e-12));
        assertThat(combined.weights().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(1.0, within(1e-12));
    }

    @Test
    void higherConfidenceLeadsAtEqualWeight() {
        StrategyCombiner combiner = combiner(new CombinerProperties());

        CombinedSignal combined = combiner.combine(SYMBOL, List.of(
                Signal.quote("alpha", SYMBOL, 49980, 50020, 0.01, 0.4, 50000, "a"),
                Signal.quote("gamma", SYMBOL, 49990, 50010, 0.01, 0.9, 50000, "g"))).orElseThrow();

        assertThat(combined.leadStrategyId()).isEqualTo("gamma");
    }

    @Test
    void opposingDirectionsCancelOut() {
        StrategyCombiner combiner = combiner(new CombinerProperties());

        Optional<CombinedSignal> combined = combiner.combine(SYMBOL, List.of(
                Signal.directional("alpha", SYMBOL, Side.BUY, 50000, 0.1, 0.8, 50000, false, "up"),
                Signal.directional("beta", SYMBOL, Side.SELL, 50000, 0.1, 0.8, 50000, false, "down")));

        assertThat(combined).isEmpty();
    }

    @Test
    void netDirectionFollowsStrongerSide() {
        StrategyCombiner combiner = combiner(new CombinerProperties());

        CombinedSignal combined = combiner.combine(SYMBOL, List.of(
                Signal.directional("alpha", SYMBOL, Side.BUY, 50010, 0.2, 0.9, 50000, false, "up"),
                Signal.directional("beta", SYMBOL, Side.SELL, 49990, 0.1, 0.3, 50000, false, "down"))).orElseThrow();

        assertThat(combined.side()).isEqualTo(SignalSide.BUY);
        assertThat(combined.size()).isCloseTo(0.2, within(1e-12));
        assertThat(combined.limitPrice()).isCloseTo(50010, within(1e-9));
    }

    @Test
    void signalsFromUnregisteredStrategiesAreDropped() {
        StrategyCombiner combiner = combiner(new CombinerProperties());

        Optional<CombinedSignal> combined = combiner.combine(SYMBOL, List.of(
                Signal.quote("rogue", SYMBOL, 49990, 50010, 5.0, 1.0, 50000, "x")));

        assertThat(combined).isEmpty();
    }

    @Test
    void weightsStaySummingToOneAndFavourProfitableStrategy() {
        CombinerProperties properties = new CombinerProperties();
        properties.setRebalanceInterval(5);
        properties.setMinObservations(3);
        StrategyCombiner combiner = combiner(properties);

        double mid = 50000;
        for (int tick = 0; tick < 40; tick++) {
            combiner.markToMarket(SYMBOL, snapshot(mid, T0.plusSeconds(tick)));
            combiner.combine(SYMBOL, List.of(
                    Signal.directional("alpha", SYMBOL, Side.BUY, mid, 0.01, 1.0, mid, false, "long"),
                    Signal.directional("beta", SYMBOL, Side.SELL, mid, 0.01, 1.0, mid, false, "short")));
            // steady uptrend with small noise
            mid *= tick % 3 == 0 ? 1.0005 : 1.002;

            Map<String, Double> weights = combiner.weights(SYMBOL);
            assertThat(weights.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
            assertThat(weights.values()).allMatch(weight -> weight >= 0.0);
        }

        Map<String, Double> weights = combiner.weights(SYMBOL);
        assertThat(weights.get("alpha")).isGreaterThan(weights.get("beta"));
    }

    @Test
    void markToMarketIsIdempotentPerTimestamp() {
        CombinerProperties properties = new CombinerProperties();
        properties.setRebalanceInterval(1);
        StrategyCombiner combiner = combiner(properties);
        MarketSnapshot snapshot = snapshot(50000, T0);

        combiner.markToMarket(SYMBOL, snapshot);
        Map<String, Double> before = combiner.weights(SYMBOL);
        combiner.markToMarket(SYMBOL, snapshot);

        assertThat(combiner.weights(SYMBOL)).isEqualTo(before);
    }

    private StrategyCombiner combiner(CombinerProperties properties) {
        return new StrategyCombiner(registry, properties, Clock.fixed(T0, ZoneOffset.UTC));
    }

    private static BasicMarketMakingStrategy strategy(String id) {
        return new BasicMarketMakingStrategy(id, List.of(SYMBOL),
                new BasicMarketMakingStrategy.Parameters(0.1, 0.1, 0.05, 0.01, 1.0, Duration.ZERO));
    }

    private static MarketSnapshot snapshot(double mid, Instant at) {
        return new MarketSnapshot(SYMBOL, mid - 5, mid + 5, List.of(new DepthLevel(mid - 5, 1)),
                List.of(new DepthLevel(mid + 5, 1)), mid, 0.1, at);
    }
}
