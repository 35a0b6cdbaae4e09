package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.PairKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of configured strategy instances, in registration order.
 */
public class StrategyRegistry {

    private final List<TradingStrategy> strategies;
    private final Map<String, Integer> registrationOrder = new LinkedHashMap<>();

    public StrategyRegistry(List<? extends TradingStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
        for (int i = 0; i < this.strategies.size(); i++) {
            TradingStrategy strategy = this.strategies.get(i);
            if (registrationOrder.putIfAbsent(strategy.id(), i) != null) {
                throw new IllegalArgumentException("Duplicate strategy id: " + strategy.id());
            }
        }
    }

    public List<TradingStrategy> all() {
        return strategies;
    }

    public int size() {
        return strategies.size();
    }

    public List<SymbolStrategy> symbolStrategies(String symbol) {
        List<SymbolStrategy> result = new ArrayList<>();
        for (TradingStrategy strategy : strategies) {
            if (strategy instanceof SymbolStrategy symbolStrategy && symbolStrategy.symbols().contains(symbol)) {
                result.add(symbolStrategy);
            }
        }
        return result;
    }

    public List<PairStrategy> pairStrategies() {
        List<PairStrategy> result = new ArrayList<>();
        for (TradingStrategy strategy : strategies) {
            if (strategy instanceof PairStrategy pairStrategy) {
                result.add(pairStrategy);
            }
        }
        return result;
    }

    /**
     * Ids of every strategy that can emit a signal for {@code symbol}, pair strategies included.
     */
    public List<String> strategyIdsFor(String symbol) {
        List<String> ids = new ArrayList<>();
        for (TradingStrategy strategy : strategies) {
            if (strategy instanceof SymbolStrategy symbolStrategy && symbolStrategy.symbols().contains(symbol)) {
                ids.add(strategy.id());
            } else if (strategy instanceof PairStrategy pairStrategy
                    && pairStrategy.pairs().stream().anyMatch(pair -> pair.contains(symbol))) {
                ids.add(strategy.id());
            }
        }
        return ids;
    }

    /**
     * Symbols evaluated by a per-symbol loop.
     */
    public Set<String> evaluatedSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (TradingStrategy strategy : strategies) {
            if (strategy instanceof SymbolStrategy symbolStrategy) {
                symbols.addAll(symbolStrategy.symbols());
            }
        }
        return symbols;
    }

    public Set<String> tradedSymbols() {
        Set<String> symbols = new LinkedHashSet<>(evaluatedSymbols());
        for (PairStrategy strategy : pairStrategies()) {
            for (PairKey pair : strategy.pairs()) {
                symbols.add(pair.first());
                symbols.add(pair.second());
            }
        }
        return symbols;
    }

    /**
     * Position of {@code strategyId} in registration order, {@link Integer#MAX_VALUE} when unknown.
     */
    public int registrationIndex(String strategyId) {
        return registrationOrder.getOrDefault(strategyId, Integer.MAX_VALUE);
    }

    public boolean contains(String strategyId) {
        return registrationOrder.containsKey(strategyId);
    }
}
