package com.ultramm.backend.trading.pipeline;

import com.ultramm.backend.config.CombinerProperties;
import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.model.SignalSide;
import com.ultramm.backend.service.strategy.StrategyRegistry;
import com.ultramm.backend.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Merges the signals of all strategies for a symbol into one weighted decision.
 * <p>
 * The lead signal is the one with the highest weight, then highest confidence, then earliest
 * registration. A quote lead produces a weighted-average quote; a directional lead produces the
 * net weighted direction, which is empty when the directions cancel out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StrategyCombiner {

    private static final double NET_EPSILON = 1e-9;

    private final StrategyRegistry strategyRegistry;
    private final CombinerProperties combinerProperties;
    private final Clock clock;
    private final ConcurrentHashMap<String, StrategyWeightBook> books = new ConcurrentHashMap<>();

    /**
     * Scores last tick's signals against the new price. Idempotent per snapshot timestamp.
     */
    public void markToMarket(String symbol, MarketSnapshot snapshot) {
        StrategyWeightBook book = book(symbol);
        synchronized (book) {
            book.markToMarket(snapshot.midPrice(), snapshot.timestamp());
        }
    }

    public Optional<CombinedSignal> combine(String symbol, List<Signal> signals) {
        StrategyWeightBook book = book(symbol);
        synchronized (book) {
            List<Signal> usable = new ArrayList<>();
            for (Signal signal : signals) {
                if (!symbol.equals(signal.symbol())) {
                    log.warn("Dropping signal from {} for {} while combining {}", signal.strategyId(), signal.symbol(), symbol);
                } else if (!book.knows(signal.strategyId())) {
                    log.warn("Dropping signal from unregistered strategy {} for {}", signal.strategyId(), symbol);
                } else if (signal.size() > 0 && signal.confidence() > 0 && signal.side() != SignalSide.HOLD) {
                    usable.add(signal);
                    book.remember(signal);
                }
            }
            if (usable.isEmpty()) {
                return Optional.empty();
            }

            Map<String, Double> weights = normalizedWeights(book, usable);
            Signal lead = usable.stream()
                    .min(Comparator.<Signal>comparingDouble(signal -> -weights.get(signal.strategyId()))
                            .thenComparingDouble(signal -> -signal.confidence())
                            .thenComparingInt(signal -> strategyRegistry.registrationIndex(signal.strategyId())))
                    .orElseThrow();
            double confidence = 0.0;
            for (Signal signal : usable) {
                confidence += weights.get(signal.strategyId()) * confidence(signal);
            }
            confidence = MathUtils.clamp(confidence, 0.0, 1.0);

            if (lead.exit()) {
                return Optional.of(new CombinedSignal(symbol, lead.side(), lead.bidPrice(), lead.askPrice(), lead.size(),
                        confidence, lead.referencePrice(), true, lead.strategyId(), weights, clock.instant()));
            }
            if (lead.side() == SignalSide.QUOTE) {
                return Optional.of(combineQuotes(symbol, usable, weights, lead, confidence));
            }
            return combineDirectional(symbol, usable, weights, lead, confidence);
        }
    }

    public Map<String, Double> weights(String symbol) {
        StrategyWeightBook book = book(symbol);
        synchronized (book) {
            return book.weights();
        }
    }

    private CombinedSignal combineQuotes(String symbol, List<Signal> signals, Map<String, Double> weights,
                                         Signal lead, double confidence) {
        double total = 0.0;
        double bid = 0.0;
        double ask = 0.0;
        double size = 0.0;
        for (Signal signal : signals) {
            if (signal.side() != SignalSide.QUOTE) {
                continue;
            }
            double w = weights.get(signal.strategyId()) * confidence(signal);
            total += w;
            bid += w * signal.bidPrice();
            ask += w * signal.askPrice();
            size += w * signal.size();
        }
        return new CombinedSignal(symbol, SignalSide.QUOTE, bid / total, ask / total, size / total, confidence,
                lead.referencePrice(), false, lead.strategyId(), weights, clock.instant());
    }

    private Optional<CombinedSignal> combineDirectional(String symbol, List<Signal> signals, Map<String, Double> weights,
                                                        Signal lead, double confidence) {
        double net = 0.0;
        for (Signal signal : signals) {
            net += weights.get(signal.strategyId()) * confidence(signal) * signal.direction();
        }
        if (Math.abs(net) < NET_EPSILON) {
            log.debug("Directional signals for {} cancel out", symbol);
            return Optional.empty();
        }
        SignalSide side = net > 0 ? SignalSide.BUY : SignalSide.SELL;
        double total = 0.0;
        double size = 0.0;
        double price = 0.0;
        for (Signal signal : signals) {
            if (signal.side() != side) {
                continue;
            }
            double w = weights.get(signal.strategyId());
            total += w;
            size += w * signal.size();
            price += w * signal.limitPrice();
        }
        size /= total;
        price /= total;
        double bid = side == SignalSide.BUY ? price : 0.0;
        double ask = side == SignalSide.SELL ? price : 0.0;
        return Optional.of(new CombinedSignal(symbol, side, bid, ask, size, confidence, lead.referencePrice(), false,
                lead.strategyId(), weights, clock.instant()));
    }

    /**
     * Book weights restricted to the strategies that signalled, renormalized to sum to 1.
     */
    private Map<String, Double> normalizedWeights(StrategyWeightBook book, List<Signal> signals) {
        Map<String, Double> weights = new LinkedHashMap<>();
        double total = 0.0;
        for (Signal signal : signals) {
            double weight = book.weight(signal.strategyId());
            weights.put(signal.strategyId(), weight);
            total += weight;
        }
        if (total <= 0) {
            double equal = 1.0 / weights.size();
            weights.replaceAll((id, weight) -> equal);
            return weights;
        }
        final double sum = total;
        weights.replaceAll((id, weight) -> weight / sum);
        return weights;
    }

    private static double confidence(Signal signal) {
        return MathUtils.clamp(signal.confidence(), 0.0, 1.0);
    }

    private StrategyWeightBook book(String symbol) {
        return books.computeIfAbsent(symbol,
                key -> new StrategyWeightBook(strategyRegistry.strategyIdsFor(key), combinerProperties));
    }
}
