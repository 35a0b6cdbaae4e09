package com.ultramm.backend.trading.pipeline;

import com.ultramm.backend.config.CombinerProperties;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.util.Ewma;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-symbol strategy weights. Each strategy is scored on the hypothetical return of the signal
 * it produced on the previous tick; weights are rebalanced from those scores every
 * {@code rebalanceInterval} ticks and always sum to 1. Callers synchronize on the instance.
 */
class StrategyWeightBook {

    private final CombinerProperties properties;
    private final Map<String, Ewma> performance = new LinkedHashMap<>();
    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final Map<String, Signal> pendingSignals = new LinkedHashMap<>();
    private double lastMid = Double.NaN;
    private Instant lastMarkTimestamp;
    private long ticks;

    StrategyWeightBook(List<String> strategyIds, CombinerProperties properties) {
        this.properties = properties;
        for (String id : strategyIds) {
            performance.put(id, Ewma.withHalfLife(properties.getPerformanceHalfLife()));
        }
        equalWeights();
    }

    boolean knows(String strategyId) {
        return performance.containsKey(strategyId);
    }

    double weight(String strategyId) {
        return weights.getOrDefault(strategyId, 0.0);
    }

    Map<String, Double> weights() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    void remember(Signal signal) {
        pendingSignals.put(signal.strategyId(), signal);
    }

    /**
     * Scores the signals remembered since the previous mark against the move to {@code mid}.
     * A second mark with the same timestamp is ignored.
     */
    void markToMarket(double mid, Instant timestamp) {
        if (mid <= 0 || timestamp.equals(lastMarkTimestamp)) {
            return;
        }
        lastMarkTimestamp = timestamp;
        if (lastMid > 0) {
            double move = (mid - lastMid) / lastMid;
            for (Signal signal : pendingSignals.values()) {
                Ewma score = performance.get(signal.strategyId());
                if (score != null && !signal.exit()) {
                    score.update(hypotheticalReturn(signal, move));
                }
            }
        }
        pendingSignals.clear();
        lastMid = mid;
        ticks++;
        if (ticks % properties.getRebalanceInterval() == 0) {
            rebalance();
        }
    }

    private double hypotheticalReturn(Signal signal, double move) {
        return switch (signal.side()) {
            case BUY -> move;
            case SELL -> -move;
            case QUOTE -> {
                double halfSpread = signal.referencePrice() > 0
                        ? (signal.askPrice() - signal.bidPrice()) / (2.0 * signal.referencePrice())
                        : 0.0;
                yield halfSpread - Math.abs(move);
            }
            case HOLD -> 0.0;
        };
    }

    double score(String strategyId) {
        Ewma returns = performance.get(strategyId);
        if (returns == null || returns.count() < properties.getMinObservations()) {
            return 0.0;
        }
        double deviation = returns.stdDev();
        return deviation > 0 ? returns.mean() / deviation : 0.0;
    }

    void rebalance() {
        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0.0;
        for (String id : performance.keySet()) {
            double value = Math.max(0.0, score(id)) + properties.getWeightFloor();
            raw.put(id, value);
            total += value;
        }
        if (total <= 0) {
            equalWeights();
            return;
        }
        weights.clear();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            weights.put(entry.getKey(), entry.getValue() / total);
        }
    }

    private void equalWeights() {
        weights.clear();
        if (performance.isEmpty()) {
            return;
        }
        double equal = 1.0 / performance.size();
        for (String id : performance.keySet()) {
            weights.put(id, equal);
        }
    }

    long ticks() {
        return ticks;
    }
}
