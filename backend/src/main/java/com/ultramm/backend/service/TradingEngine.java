package com.ultramm.backend.service;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.config.EngineProperties;
import com.ultramm.backend.config.ExecutionProperties;
import com.ultramm.backend.dto.EngineStatus;
import com.ultramm.backend.exception.NotFoundException;
import com.ultramm.backend.model.PairKey;
import com.ultramm.backend.service.exchange.SimulatedMarketFeed;
import com.ultramm.backend.service.execution.ExecutionCoordinator;
import com.ultramm.backend.service.marketdata.MarketDataStreamService;
import com.ultramm.backend.service.risk.SuspensionRegistry;
import com.ultramm.backend.service.strategy.PairStrategy;
import com.ultramm.backend.service.strategy.StrategyRegistry;
import com.ultramm.backend.service.strategy.SymbolStrategy;
import com.ultramm.backend.trading.pipeline.TradeDecisionPipelineService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the evaluation loops: one fixed-delay task per symbol and one per (pair strategy, pair).
 * Fixed delay means two runs of the same task never overlap.
 */
@Service
@Slf4j
public class TradingEngine implements ApplicationRunner {

    private final StrategyRegistry strategyRegistry;
    private final TradeDecisionPipelineService pipeline;
    private final ExecutionCoordinator executionCoordinator;
    private final MarketDataStreamService marketDataStreamService;
    private final SuspensionRegistry suspensionRegistry;
    private final DataProperties dataProperties;
    private final ExecutionProperties executionProperties;
    private final EngineProperties engineProperties;
    private final ObjectProvider<SimulatedMarketFeed> simulatedMarketFeed;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> symbolTasks = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pairTasks = new ConcurrentHashMap<>();
    private final Set<String> stoppedSymbols = ConcurrentHashMap.newKeySet();
    // strategyId|symbol -> last evaluation, for strategies with a refresh interval
    private final Map<String, Instant> lastEvaluated = new ConcurrentHashMap<>();
    private volatile boolean running;

    public TradingEngine(StrategyRegistry strategyRegistry,
                         TradeDecisionPipelineService pipeline,
                         ExecutionCoordinator executionCoordinator,
                         MarketDataStreamService marketDataStreamService,
                         SuspensionRegistry suspensionRegistry,
                         DataProperties dataProperties,
                         ExecutionProperties executionProperties,
                         EngineProperties engineProperties,
                         ObjectProvider<SimulatedMarketFeed> simulatedMarketFeed,
                         @Qualifier("tradingScheduler") TaskScheduler scheduler,
                         Clock clock) {
        this.strategyRegistry = strategyRegistry;
        this.pipeline = pipeline;
        this.executionCoordinator = executionCoordinator;
        this.marketDataStreamService = marketDataStreamService;
        this.suspensionRegistry = suspensionRegistry;
        this.dataProperties = dataProperties;
        this.executionProperties = executionProperties;
        this.engineProperties = engineProperties;
        this.simulatedMarketFeed = simulatedMarketFeed;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (engineProperties.isAutoStart()) {
            start();
        } else {
            log.info("Trading engine auto-start disabled");
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        marketDataStreamService.subscribeAll(strategyRegistry.tradedSymbols());
        for (String symbol : strategyRegistry.evaluatedSymbols()) {
            if (!stoppedSymbols.contains(symbol)) {
                scheduleSymbol(symbol);
            }
        }
        for (PairStrategy strategy : strategyRegistry.pairStrategies()) {
            for (PairKey pair : strategy.pairs()) {
                pairTasks.computeIfAbsent(strategy.id() + ":" + pair.id(), key -> scheduler.scheduleWithFixedDelay(
                        () -> runPair(strategy, pair), dataProperties.getTickInterval()));
            }
        }
        simulatedMarketFeed.ifAvailable(SimulatedMarketFeed::start);
        running = true;
        log.info("Trading engine started: {} strategies, {} symbol loops, {} pair loops",
                strategyRegistry.size(), symbolTasks.size(), pairTasks.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        simulatedMarketFeed.ifAvailable(SimulatedMarketFeed::stop);
        pairTasks.values().forEach(task -> task.cancel(false));
        pairTasks.clear();
        for (String symbol : strategyRegistry.tradedSymbols()) {
            ScheduledFuture<?> task = symbolTasks.remove(symbol);
            if (task != null) {
                task.cancel(false);
            }
            pipeline.disable(symbol);
            executionCoordinator.closeSymbol(symbol);
        }
        executionCoordinator.cancelAll("engine stopping");
        for (String symbol : strategyRegistry.tradedSymbols()) {
            executionCoordinator.awaitTerminal(symbol, executionProperties.getStopTimeout());
            if (!stoppedSymbols.contains(symbol)) {
                executionCoordinator.openSymbol(symbol);
                pipeline.enable(symbol);
            }
        }
        log.info("Trading engine stopped");
    }

    /**
     * Stops trading {@code symbol}: no new decisions, the in-flight one completes, open orders are
     * canceled and awaited up to the stop timeout.
     *
     * @return true when every open order was confirmed terminal
     */
    public boolean stopSymbol(String symbol) {
        requireKnown(symbol);
        stoppedSymbols.add(symbol);
        ScheduledFuture<?> task = symbolTasks.remove(symbol);
        if (task != null) {
            task.cancel(false);
        }
        pipeline.disable(symbol);
        executionCoordinator.closeSymbol(symbol);
        executionCoordinator.cancelOpenOrders(symbol, "symbol stopped");
        boolean clean = executionCoordinator.awaitTerminal(symbol, executionProperties.getStopTimeout());
        log.info("Symbol {} stopped{}", symbol, clean ? "" : " with unconfirmed orders");
        return clean;
    }

    public void startSymbol(String symbol) {
        requireKnown(symbol);
        stoppedSymbols.remove(symbol);
        executionCoordinator.openSymbol(symbol);
        pipeline.enable(symbol);
        if (running && strategyRegistry.evaluatedSymbols().contains(symbol)) {
            scheduleSymbol(symbol);
        }
        log.info("Symbol {} started", symbol);
    }

    public boolean isRunning() {
        return running;
    }

    public EngineStatus status() {
        SuspensionRegistry.Status suspension = suspensionRegistry.status();
        return new EngineStatus(
                running,
                new TreeSet<>(symbolTasks.keySet()),
                new TreeSet<>(stoppedSymbols),
                pairTasks.size(),
                executionCoordinator.haltedExchanges(),
                suspension.globallySuspended(),
                suspension.globalReason(),
                new TreeSet<>(suspension.symbols().keySet()),
                clock.instant()
        );
    }

    /**
     * Symbol strategies whose refresh interval has elapsed for {@code symbol}.
     */
    List<SymbolStrategy> dueStrategies(String symbol, Instant now) {
        List<SymbolStrategy> due = new ArrayList<>();
        for (SymbolStrategy strategy : strategyRegistry.symbolStrategies(symbol)) {
            Duration interval = strategy.refreshInterval();
            String key = strategy.id() + "|" + symbol;
            Instant last = lastEvaluated.get(key);
            if (interval.isZero() || last == null || !now.isBefore(last.plus(interval))) {
                lastEvaluated.put(key, now);
                due.add(strategy);
            }
        }
        return due;
    }

    private void scheduleSymbol(String symbol) {
        symbolTasks.computeIfAbsent(symbol, key -> scheduler.scheduleWithFixedDelay(
                () -> runSymbol(key), dataProperties.getTickInterval()));
    }

    private void runSymbol(String symbol) {
        try {
            pipeline.evaluateSymbol(symbol, dueStrategies(symbol, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Evaluation of {} failed", symbol, e);
        }
    }

    private void runPair(PairStrategy strategy, PairKey pair) {
        try {
            pipeline.evaluatePair(strategy, pair);
        } catch (RuntimeException e) {
            log.error("Evaluation of pair {} by {} failed", pair.id(), strategy.id(), e);
        }
    }

    private void requireKnown(String symbol) {
        if (!strategyRegistry.tradedSymbols().contains(symbol)) {
            throw new NotFoundException("Symbol not traded: " + symbol);
        }
    }
}
