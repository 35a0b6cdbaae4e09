package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.IndicatorSet;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.model.SignalSide;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BasicMarketMakingStrategyTest {

    private static final String SYMBOL = "BTC/USDT";

    private final BasicMarketMakingStrategy strategy = new BasicMarketMakingStrategy("basic", List.of(SYMBOL),
            new BasicMarketMakingStrategy.Parameters(0.1, 0.1, 0.05, 0.01, 1.0, Duration.ZERO));

    @Test
    void quotesFixedSpreadAroundMid() {
        Optional<Signal> signal = strategy.evaluate(SYMBOL, view(49995, 50005), PositionSnapshot.flat(SYMBOL));

        assertThat(signal).isPresent();
        assertThat(signal.get().side()).isEqualTo(SignalSide.QUOTE);
        assertThat(signal.get().bidPrice()).isCloseTo(49975.0, within(1e-6));
        assertThat(signal.get().askPrice()).isCloseTo(50025.0, within(1e-6));
        assertThat(signal.get().size()).isEqualTo(0.01);
        assertThat(signal.get().confidence()).isEqualTo(1.0);
    }

    @Test
    void suppressedWhenPositionAtLimit() {
        PositionSnapshot atLimit = new PositionSnapshot(SYMBOL, -1.0, 50000, 0, 0, 1);

        assertThat(strategy.evaluate(SYMBOL, view(49995, 50005), atLimit)).isEmpty();
    }

    @Test
    void widensSpreadToMinimumProfit() {
        BasicMarketMakingStrategy tight = new BasicMarketMakingStrategy("tight", List.of(SYMBOL),
                new BasicMarketMakingStrategy.Parameters(0.01, 0.01, 0.05, 0.01, 1.0, Duration.ZERO));

        Signal signal = tight.evaluate(SYMBOL, view(49995, 50005), PositionSnapshot.flat(SYMBOL)).orElseThrow();

        double spreadPercent = (signal.askPrice() - signal.bidPrice()) / 50000 * 100;
        assertThat(spreadPercent).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void repeatedEvaluationIsIdempotent() {
        MarketView view = view(49995, 50005);
        PositionSnapshot position = PositionSnapshot.flat(SYMBOL);

        assertThat(strategy.evaluate(SYMBOL, view, position)).isEqualTo(strategy.evaluate(SYMBOL, view, position));
    }

    static MarketView view(double bid, double ask) {
        MarketSnapshot snapshot = new MarketSnapshot(SYMBOL, bid, ask,
                List.of(new DepthLevel(bid, 1.0)), List.of(new DepthLevel(ask, 1.0)),
                (bid + ask) / 2, 0.1, Instant.parse("2024-01-01T00:00:00Z"));
        return new MarketView(snapshot, IndicatorSet.NEUTRAL);
    }
}
