package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.IndicatorSet;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PairKey;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.model.SignalSide;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticalArbitrageStrategyTest {

    private static final PairKey PAIR = new PairKey("BTC/USDT", "ETH/USDT");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final StatisticalArbitrageStrategy strategy = new StatisticalArbitrageStrategy("stat-arb", List.of(PAIR),
            new StatisticalArbitrageStrategy.Parameters(2.0, 0.5, 0.01, 1.0, 50.0, 10, 5));

    private final MarketView btc = view("BTC/USDT", 50000, T0);
    private final MarketView eth = view("ETH/USDT", 3000, T0);

    @Test
    void noSignalBelowEntryThreshold() {
        List<Signal> signals = strategy.decide(PAIR, 1.0, 1.0, 1, btc, eth,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));

        assertThat(signals).isEmpty();
    }

    @Test
    void entersAboveThresholdSellingRichLeg() {
        List<Signal> signals = strategy.decide(PAIR, 2.5, 1.0, 1, btc, eth,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));

        assertThat(signals).hasSize(2);
        Signal first = signals.get(0);
        Signal second = signals.get(1);
        assertThat(second.symbol()).isEqualTo("ETH/USDT");
        assertThat(second.side()).isEqualTo(SignalSide.SELL);
        assertThat(second.size()).isCloseTo(0.01, within(1e-12));
        assertThat(first.side()).isEqualTo(SignalSide.BUY);
        assertThat(first.size()).isCloseTo(0.01 * 3000 / 50000, within(1e-12));
        assertThat(first.exit()).isFalse();
        assertThat(second.confidence()).isCloseTo(0.625, within(1e-12));
    }

    @Test
    void persistentDivergenceScalesDownEntrySize() {
        List<Signal> signals = strategy.decide(PAIR, -3.0, 1.0, 4, btc, eth,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));

        assertThat(signals.get(1).side()).isEqualTo(SignalSide.BUY);
        assertThat(signals.get(1).size()).isCloseTo(0.0025, within(1e-12));
    }

    @Test
    void exitsHeldLegsWhenSpreadReverts() {
        PositionSnapshot longBtc = new PositionSnapshot("BTC/USDT", 0.0006, 50000, 0, 0, 1);
        PositionSnapshot shortEth = new PositionSnapshot("ETH/USDT", -0.01, 3000, 0, 0, 1);

        List<Signal> signals = strategy.decide(PAIR, 0.2, 1.0, 1, btc, eth, longBtc, shortEth);

        assertThat(signals).hasSize(2);
        assertThat(signals).allMatch(Signal::exit);
        assertThat(signals.get(0).side()).isEqualTo(SignalSide.SELL);
        assertThat(signals.get(0).size()).isEqualTo(0.0006);
        assertThat(signals.get(1).side()).isEqualTo(SignalSide.BUY);
        assertThat(signals.get(1).size()).isEqualTo(0.01);
    }

    @Test
    void entrySuppressedWhenLegAtLimit() {
        PositionSnapshot shortEthAtLimit = new PositionSnapshot("ETH/USDT", -1.0, 3000, 0, 0, 1);

        List<Signal> signals = strategy.decide(PAIR, 2.5, 1.0, 1, btc, eth,
                PositionSnapshot.flat("BTC/USDT"), shortEthAtLimit);

        assertThat(signals).isEmpty();
    }

    @Test
    void undefinedZScoreProducesNothing() {
        assertThat(strategy.decide(PAIR, Double.NaN, 1.0, 1, btc, eth,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"))).isEmpty();
    }

    @Test
    void unchangedSnapshotsGiveSameSignals() {
        // BTC flat keeps the hedge ratio at 1; ETH oscillates 0.1% around 3000
        for (int i = 0; i < 40; i++) {
            Instant at = T0.plusSeconds(i);
            double ethPrice = 3000 * (1 + (i % 2 == 0 ? 0.001 : -0.001));
            strategy.evaluate(PAIR, view("BTC/USDT", 50000, at), view("ETH/USDT", ethPrice, at),
                    PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));
        }
        Instant last = T0.plusSeconds(40);
        MarketView first = view("BTC/USDT", 50000, last);
        MarketView second = view("ETH/USDT", 3150, last);

        List<Signal> once = strategy.evaluate(PAIR, first, second,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));
        List<Signal> twice = strategy.evaluate(PAIR, first, second,
                PositionSnapshot.flat("BTC/USDT"), PositionSnapshot.flat("ETH/USDT"));

        assertThat(twice).isEqualTo(once);
        assertThat(once).hasSize(2);
        assertThat(once.get(0).side()).isEqualTo(SignalSide.BUY);
        assertThat(once.get(1).side()).isEqualTo(SignalSide.SELL);
        assertThat(once.get(1).direction()).isEqualTo(Side.SELL.sign());
        assertThat(once.get(1).size()).isCloseTo(0.01, within(1e-12));
    }

    private static MarketView view(String symbol, double mid, Instant at) {
        double half = mid * 0.0001;
        MarketSnapshot snapshot = new MarketSnapshot(symbol, mid - half, mid + half,
                List.of(new DepthLevel(mid - half, 1.0)), List.of(new DepthLevel(mid + half, 1.0)),
                mid, 0.1, at);
        return new MarketView(snapshot, IndicatorSet.NEUTRAL);
    }
}
