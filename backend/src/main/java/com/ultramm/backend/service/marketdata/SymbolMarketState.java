package com.ultramm.backend.service.marketdata;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.model.DepthEvent;
import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.IndicatorSet;
import com.ultramm.backend.model.MarketEvent;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.TradeEvent;
import com.ultramm.backend.util.Ewma;
import com.ultramm.backend.util.MathUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-symbol state behind {@link MarketDataCache}. Guarded by its own lock; updates build
 * the new snapshot and indicators first and publish them together, so readers never see a mix.
 */
@Slf4j
class SymbolMarketState {

    private final String symbol;
    private final int depthLevels;
    private final ReentrantLock lock = new ReentrantLock();
    private final CandleWindow candles;
    private final Ewma spreadBaseline;
    private final Ewma depthBaseline;

    private MarketSnapshot snapshot;
    private IndicatorSet indicators = IndicatorSet.NEUTRAL;
    private double spreadRatio = 1.0;
    private double liquidityScore = 1.0;

    SymbolMarketState(String symbol, DataProperties properties) {
        this.symbol = symbol;
        this.depthLevels = properties.getOrderBookDepth();
        this.candles = new CandleWindow(properties);
        this.spreadBaseline = new Ewma(properties.getBaselineAlpha());
        this.depthBaseline = new Ewma(properties.getBaselineAlpha());
    }

    ReentrantLock lock() {
        return lock;
    }

    MarketSnapshot snapshot() {
        return snapshot;
    }

    IndicatorSet indicators() {
        return indicators;
    }

    boolean apply(MarketEvent event) {
        if (event instanceof DepthEvent depth) {
            return applyDepth(depth);
        }
        if (event instanceof TradeEvent trade) {
            return applyTrade(trade);
        }
        log.warn("Ignoring unsupported market event {} for {}", event.getClass().getSimpleName(), symbol);
        return false;
    }

    private boolean applyDepth(DepthEvent event) {
        if (event.bids() == null || event.asks() == null || event.bids().isEmpty() || event.asks().isEmpty()) {
            log.warn("Ignoring one-sided depth update for {}", symbol);
            return false;
        }
        if (snapshot != null && event.timestamp().isBefore(snapshot.timestamp())) {
            log.debug("Ignoring out-of-order depth update for {} at {}", symbol, event.timestamp());
            return false;
        }
        List<DepthLevel> bids = event.bids().stream()
                .filter(level -> level.price() > 0 && level.quantity() > 0)
                .sorted(Comparator.comparingDouble(DepthLevel::price).reversed())
                .limit(depthLevels)
                .toList();
        List<DepthLevel> asks = event.asks().stream()
                .filter(level -> level.price() > 0 && level.quantity() > 0)
                .sorted(Comparator.comparingDouble(DepthLevel::price))
                .limit(depthLevels)
                .toList();
        if (bids.isEmpty() || asks.isEmpty() || bids.get(0).price() >= asks.get(0).price()) {
            log.warn("Ignoring invalid or crossed book for {}", symbol);
            return false;
        }

        double bestBid = bids.get(0).price();
        double bestAsk = asks.get(0).price();
        double lastPrice = snapshot != null && snapshot.lastPrice() > 0 ? snapshot.lastPrice() : (bestBid + bestAsk) / 2.0;
        double lastSize = snapshot != null ? snapshot.lastSize() : 0.0;
        MarketSnapshot next = new MarketSnapshot(symbol, bestBid, bestAsk, bids, asks, lastPrice, lastSize, event.timestamp());

        double spread = next.spread();
        spreadRatio = spreadBaseline.isEmpty() ? 1.0 : MathUtils.ratio(spread, spreadBaseline.mean(), 1.0);
        spreadBaseline.update(spread);
        double depth = next.depthQuantity(depthLevels);
        liquidityScore = depthBaseline.isEmpty() ? 1.0 : MathUtils.ratio(depth, depthBaseline.mean(), 1.0);
        depthBaseline.update(depth);

        publish(next);
        return true;
    }

    private boolean applyTrade(TradeEvent event) {
        if (event.price() <= 0 || event.size() < 0) {
            log.warn("Ignoring invalid trade for {}: price={} size={}", symbol, event.price(), event.size());
            return false;
        }
        candles.onTrade(event.price(), event.size(), event.timestamp());
        MarketSnapshot next;
        if (snapshot == null) {
            next = new MarketSnapshot(symbol, 0.0, 0.0, List.of(), List.of(), event.price(), event.size(), event.timestamp());
        } else {
            next = new MarketSnapshot(symbol, snapshot.bestBid(), snapshot.bestAsk(), snapshot.bids(), snapshot.asks(),
                    event.price(), event.size(),
                    event.timestamp().isAfter(snapshot.timestamp()) ? event.timestamp() : snapshot.timestamp());
        }
        publish(next);
        return true;
    }

    private void publish(MarketSnapshot next) {
        IndicatorSet nextIndicators = new IndicatorSet(
                candles.volatility(),
                candles.volatilityRatio(),
                candles.volumeRatio(),
                candles.trend(),
                liquidityScore,
                spreadRatio,
                candles.meanReversion(next.midPrice()),
                candles.closedCandles()
        );
        snapshot = next;
        indicators = nextIndicators;
    }
}
