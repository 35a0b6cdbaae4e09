package com.ultramm.backend.trading.pipeline;

import com.ultramm.backend.event.CombinedSignalEvent;
import com.ultramm.backend.event.RiskDecisionEvent;
import com.ultramm.backend.exception.DataStaleException;
import com.ultramm.backend.model.CombinedSignal;
import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PairKey;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.model.RiskReasonCode;
import com.ultramm.backend.model.Signal;
import com.ultramm.backend.service.execution.ExecutionCoordinator;
import com.ultramm.backend.service.execution.OrderHandle;
import com.ultramm.backend.service.execution.PositionBook;
import com.ultramm.backend.service.marketdata.MarketDataCache;
import com.ultramm.backend.service.risk.RiskManager;
import com.ultramm.backend.service.strategy.PairStrategy;
import com.ultramm.backend.service.strategy.SymbolStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One evaluation cycle: market view, strategies, combiner, risk gate, execution.
 * <p>
 * Strategies run without any lock. Gating and submission hold the symbol's lock so the
 * position seen by the risk manager is the one orders are placed against.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeDecisionPipelineService {

    private final MarketDataCache marketDataCache;
    private final StrategyCombiner strategyCombiner;
    private final RiskManager riskManager;
    private final ExecutionCoordinator executionCoordinator;
    private final PositionBook positionBook;
    private final SymbolLockRegistry symbolLockRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Set<String> disabledSymbols = ConcurrentHashMap.newKeySet();

    public PipelineResult evaluateSymbol(String symbol, Collection<SymbolStrategy> strategies) {
        MDC.put("symbol", symbol);
        try {
            if (disabledSymbols.contains(symbol)) {
                return PipelineResult.skipped(symbol, PipelineResult.Status.DISABLED);
            }
            MarketView view;
            try {
                view = marketDataCache.read(symbol);
            } catch (DataStaleException e) {
                log.debug("Skipping {}: {}", symbol, e.getMessage());
                return PipelineResult.skipped(symbol, PipelineResult.Status.STALE_DATA);
            }
            strategyCombiner.markToMarket(symbol, view.snapshot());

            PositionSnapshot position = positionBook.snapshot(symbol);
            List<Signal> signals = new ArrayList<>();
            for (SymbolStrategy strategy : strategies) {
                try {
                    strategy.evaluate(symbol, view, position).ifPresent(signals::add);
                } catch (RuntimeException e) {
                    log.error("Strategy {} failed on {}", strategy.id(), symbol, e);
                }
            }
            return decide(symbol, signals, view);
        } finally {
            MDC.remove("symbol");
        }
    }

    /**
     * Evaluates a pair strategy and runs each leg through the combiner and the risk gate on its own.
     */
    public List<PipelineResult> evaluatePair(PairStrategy strategy, PairKey pair) {
        MarketView first;
        MarketView second;
        try {
            first = marketDataCache.read(pair.first());
            second = marketDataCache.read(pair.second());
        } catch (DataStaleException e) {
            log.debug("Skipping pair {}: {}", pair.id(), e.getMessage());
            return List.of(PipelineResult.skipped(pair.first(), PipelineResult.Status.STALE_DATA),
                    PipelineResult.skipped(pair.second(), PipelineResult.Status.STALE_DATA));
        }
        List<Signal> signals;
        try {
            signals = strategy.evaluate(pair, first, second,
                    positionBook.snapshot(pair.first()), positionBook.snapshot(pair.second()));
        } catch (RuntimeException e) {
            log.error("Pair strategy {} failed on {}", strategy.id(), pair.id(), e);
            return List.of(PipelineResult.skipped(pair.first(), PipelineResult.Status.FAILED),
                    PipelineResult.skipped(pair.second(), PipelineResult.Status.FAILED));
        }
        List<PipelineResult> results = new ArrayList<>();
        for (MarketView leg : List.of(first, second)) {
            String symbol = leg.symbol();
            List<Signal> legSignals = signals.stream().filter(signal -> symbol.equals(signal.symbol())).toList();
            if (legSignals.isEmpty()) {
                continue;
            }
            MDC.put("symbol", symbol);
            try {
                if (disabledSymbols.contains(symbol)) {
                    results.add(PipelineResult.skipped(symbol, PipelineResult.Status.DISABLED));
                } else {
                    results.add(decide(symbol, legSignals, leg));
                }
            } finally {
                MDC.remove("symbol");
            }
        }
        return results;
    }

    private PipelineResult decide(String symbol, List<Signal> signals, MarketView view) {
        CombinedSignal combined = strategyCombiner.combine(symbol, signals)
                .orElseGet(() -> CombinedSignal.hold(symbol, view.midPrice(), clock.instant()));
        eventPublisher.publishEvent(new CombinedSignalEvent(combined));

        ReentrantLock lock = symbolLockRegistry.lockFor(symbol);
        lock.lock();
        try {
            if (disabledSymbols.contains(symbol)) {
                return PipelineResult.skipped(symbol, PipelineResult.Status.DISABLED);
            }
            PositionSnapshot position = positionBook.snapshot(symbol);
            RiskDecision decision = riskManager.gate(symbol, combined, position, view.indicators());
            if (decision.reason() != RiskReasonCode.NO_SIGNAL) {
                eventPublisher.publishEvent(new RiskDecisionEvent(decision));
            }
            if (!decision.isApproved()) {
                PipelineResult.Status status = decision.reason() == RiskReasonCode.NO_SIGNAL
                        ? PipelineResult.Status.NO_ACTION : PipelineResult.Status.REJECTED;
                return new PipelineResult(symbol, status, signals.size(), combined, decision, OrderHandle.empty(symbol));
            }
            OrderHandle handle = executionCoordinator.submit(decision);
            return new PipelineResult(symbol, PipelineResult.Status.SUBMITTED, signals.size(), combined, decision, handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops new decisions for {@code symbol}. An evaluation already holding the symbol lock finishes first.
     */
    public void disable(String symbol) {
        disabledSymbols.add(symbol);
        ReentrantLock lock = symbolLockRegistry.lockFor(symbol);
        lock.lock();
        lock.unlock();
    }

    public void enable(String symbol) {
        disabledSymbols.remove(symbol);
    }

    public boolean isDisabled(String symbol) {
        return disabledSymbols.contains(symbol);
    }
}
