package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PairKey;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.model.Signal;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mean-reversion on the log-price spread of a pair.
 * <ul>
 *   <li>|z| above the entry threshold: sell the rich leg, buy the cheap one, hedged by beta</li>
 *   <li>|z| below the exit threshold while holding: flatten both legs</li>
 * </ul>
 * Entry size is divided by the number of recent ticks that were already past the threshold,
 * so a persisting divergence is not pyramided at full size.
 */
@Slf4j
public class StatisticalArbitrageStrategy implements PairStrategy {

    public record Parameters(
            double entryZScore,
            double exitZScore,
            double positionSize,
            double maxPosition,
            double halfLifeTicks,
            int warmUpTicks,
            int persistenceWindow
    ) {}

    private final String id;
    private final List<PairKey> pairs;
    private final Parameters parameters;
    private final Map<PairKey, PairStatistics> statistics = new ConcurrentHashMap<>();

    public StatisticalArbitrageStrategy(String id, List<PairKey> pairs, Parameters parameters) {
        this.id = id;
        this.pairs = List.copyOf(pairs);
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.STATISTICAL_ARBITRAGE;
    }

    @Override
    public List<PairKey> pairs() {
        return pairs;
    }

    public Parameters parameters() {
        return parameters;
    }

    /**
     * Repeated calls with unchanged snapshots return the same signals and leave the statistics as they were.
     */
    @Override
    public List<Signal> evaluate(PairKey pair, MarketView first, MarketView second,
                                 PositionSnapshot firstPosition, PositionSnapshot secondPosition) {
        PairStatistics stats = statistics.computeIfAbsent(pair, key -> new PairStatistics(
                parameters.halfLifeTicks(), parameters.warmUpTicks(), parameters.persistenceWindow(),
                parameters.entryZScore()));
        double zScore;
        double hedgeRatio;
        int persistence;
        synchronized (stats) {
            stats.observe(first.snapshot(), second.snapshot());
            zScore = stats.zScore();
            hedgeRatio = stats.hedgeRatio();
            persistence = stats.persistence();
        }
        return decide(pair, zScore, hedgeRatio, persistence, first, second, firstPosition, secondPosition);
    }

    List<Signal> decide(PairKey pair, double zScore, double hedgeRatio, int persistence,
                        MarketView first, MarketView second,
                        PositionSnapshot firstPosition, PositionSnapshot secondPosition) {
        if (Double.isNaN(zScore)) {
            return List.of();
        }
        double absZ = Math.abs(zScore);
        boolean holding = !firstPosition.isFlat() || !secondPosition.isFlat();

        if (holding && absZ < parameters.exitZScore()) {
            List<Signal> exits = new ArrayList<>(2);
            addExit(exits, first.snapshot(), firstPosition, zScore);
            addExit(exits, second.snapshot(), secondPosition, zScore);
            log.info("{} exiting {} at z={}", id, pair, String.format("%.3f", zScore));
            return exits;
        }
        if (absZ <= parameters.entryZScore()) {
            return List.of();
        }

        double priceFirst = first.midPrice();
        double priceSecond = second.midPrice();
        double sizeSecond = parameters.positionSize() / persistence;
        double sizeFirst = Math.abs(hedgeRatio) * sizeSecond * priceSecond / priceFirst;

        // z > 0: second leg rich relative to first
        Side secondSide = zScore > 0 ? Side.SELL : Side.BUY;
        Side firstSide = hedgeRatio >= 0 ? secondSide.opposite() : secondSide;

        if (exceedsLimit(firstPosition, firstSide) || exceedsLimit(secondPosition, secondSide)) {
            log.debug("{} entry suppressed for {}: leg at position limit", id, pair);
            return List.of();
        }
        double confidence = Math.min(1.0, absZ / (2.0 * parameters.entryZScore()));
        String reason = String.format("z=%.3f beta=%.3f", zScore, hedgeRatio);
        List<Signal> signals = new ArrayList<>(2);
        if (sizeFirst > 0) {
            signals.add(entry(first.snapshot(), firstSide, sizeFirst, confidence, reason));
        }
        signals.add(entry(second.snapshot(), secondSide, sizeSecond, confidence, reason));
        return signals;
    }

    private boolean exceedsLimit(PositionSnapshot position, Side side) {
        double exposure = position.quantity() * side.sign();
        return exposure >= parameters.maxPosition();
    }

    private Signal entry(MarketSnapshot snapshot, Side side, double size, double confidence, String reason) {
        return Signal.directional(id, snapshot.symbol(), side, aggressivePrice(snapshot, side), size, confidence,
                snapshot.midPrice(), false, reason);
    }

    private void addExit(List<Signal> exits, MarketSnapshot snapshot, PositionSnapshot position, double zScore) {
        if (position.isFlat()) {
            return;
        }
        Side side = position.quantity() > 0 ? Side.SELL : Side.BUY;
        exits.add(Signal.directional(id, snapshot.symbol(), side, aggressivePrice(snapshot, side),
                Math.abs(position.quantity()), 1.0, snapshot.midPrice(), true,
                String.format("exit z=%.3f", zScore)));
    }

    private static double aggressivePrice(MarketSnapshot snapshot, Side side) {
        if (!snapshot.hasBook()) {
            return snapshot.midPrice();
        }
        return side == Side.BUY ? snapshot.bestAsk() : snapshot.bestBid();
    }
}
