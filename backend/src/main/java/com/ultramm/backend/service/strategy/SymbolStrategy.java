package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Signal;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Strategy that evaluates one symbol at a time. Evaluation must not mutate shared state.
 */
public interface SymbolStrategy extends TradingStrategy {

    List<String> symbols();

    Optional<Signal> evaluate(String symbol, MarketView view, PositionSnapshot position);

    /**
     * Minimum time between two evaluations of the same symbol. {@link Duration#ZERO} means every tick.
     */
    default Duration refreshInterval() {
        return Duration.ZERO;
    }
}
