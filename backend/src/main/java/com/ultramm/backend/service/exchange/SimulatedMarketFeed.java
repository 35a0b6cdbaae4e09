package com.ultramm.backend.service.exchange;

import com.ultramm.backend.config.MarketsProperties;
import com.ultramm.backend.model.DepthEvent;
import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.TradeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Random-walk market generator feeding the paper exchange in simulation mode.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "markets", name = "mode", havingValue = "simulation", matchIfMissing = true)
public class SimulatedMarketFeed {

    private static final int LEVELS = 10;

    private final PaperExchangeConnector exchange;
    private final MarketsProperties marketsProperties;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Random random;
    private final Map<String, Double> mids = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> task;

    public SimulatedMarketFeed(PaperExchangeConnector exchange,
                               MarketsProperties marketsProperties,
                               @Qualifier("tradingScheduler") TaskScheduler scheduler,
                               Clock clock) {
        this.exchange = exchange;
        this.marketsProperties = marketsProperties;
        this.scheduler = scheduler;
        this.clock = clock;
        this.random = new Random(marketsProperties.getSimulation().getSeed());
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::tick, marketsProperties.getSimulation().getInterval());
        log.info("Simulated market feed started for {}", marketsProperties.getSymbols());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Simulated market feed stopped");
        }
    }

    void tick() {
        try {
            for (String symbol : marketsProperties.getSymbols()) {
                publish(symbol, clock.instant());
            }
        } catch (RuntimeException e) {
            log.error("Simulated market tick failed", e);
        }
    }

    private void publish(String symbol, Instant now) {
        MarketsProperties.Simulation simulation = marketsProperties.getSimulation();
        double mid = mids.computeIfAbsent(symbol, key -> simulation.getInitialPrices().getOrDefault(key, 100.0));
        double shock = random.nextGaussian() * simulation.getVolatilityPercent() / 100.0;
        mid = mid * Math.exp(shock);
        mids.put(symbol, mid);

        double halfSpread = mid * simulation.getSpreadPercent() / 200.0;
        double step = mid * simulation.getSpreadPercent() / 100.0;
        List<DepthLevel> bids = new ArrayList<>(LEVELS);
        List<DepthLevel> asks = new ArrayList<>(LEVELS);
        for (int i = 0; i < LEVELS; i++) {
            double quantity = simulation.getLevelQuantity() * (0.5 + random.nextDouble());
            bids.add(new DepthLevel(mid - halfSpread - i * step, quantity));
            asks.add(new DepthLevel(mid + halfSpread + i * step, quantity));
        }
        exchange.onMarketEvent(new DepthEvent(symbol, bids, asks, now));

        double tradePrice = random.nextBoolean() ? mid + halfSpread : mid - halfSpread;
        double tradeSize = simulation.getLevelQuantity() * 0.1 * random.nextDouble();
        exchange.onMarketEvent(new TradeEvent(symbol, tradePrice, tradeSize, now));
    }
}
