package com.ultramm.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ordersPlaced = new AtomicLong();
    private final AtomicLong exchangeFailures = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final AtomicReference<Double> equity = new AtomicReference<>(0.0);
    private final AtomicReference<Double> totalPnl = new AtomicReference<>(0.0);
    private final AtomicReference<Double> drawdownCurrent = new AtomicReference<>(0.0);

    private Counter ordersPlacedCounter;
    private Counter ordersFilledCounter;
    private Counter exchangeErrorsCounter;
    private Counter haltsCounter;
    private Timer submitLatency;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        ordersFilledCounter = Counter.builder("orders_filled_total").register(meterRegistry);
        exchangeErrorsCounter = Counter.builder("exchange_errors_total").register(meterRegistry);
        haltsCounter = Counter.builder("trading_halts_total").register(meterRegistry);
        submitLatency = Timer.builder("order_submit_latency").register(meterRegistry);
        Gauge.builder("equity", equity, value -> value.get()).register(meterRegistry);
        Gauge.builder("pnl_total", totalPnl, value -> value.get()).register(meterRegistry);
        Gauge.builder("drawdown_current", drawdownCurrent, value -> value.get()).register(meterRegistry);
    }

    public void incrementOrdersPlaced() {
        ordersPlaced.incrementAndGet();
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordOrderFilled() {
        if (ordersFilledCounter != null) {
            ordersFilledCounter.increment();
        }
    }

    public void incrementExchangeFailures() {
        exchangeFailures.incrementAndGet();
        if (exchangeErrorsCounter != null) {
            exchangeErrorsCounter.increment();
        }
    }

    public void recordHalt() {
        if (haltsCounter != null) {
            haltsCounter.increment();
        }
    }

    public void recordSubmitLatency(Duration latency) {
        if (submitLatency != null) {
            submitLatency.record(latency);
        }
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("orders_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrderTransition(String state) {
        Counter.builder("order_transitions_total")
                .tag("state", state)
                .register(meterRegistry)
                .increment();
    }

    public void recordCombinedSignal(String symbol, String side) {
        Counter.builder("signals_combined_total")
                .tag("symbol", symbol)
                .tag("side", side)
                .register(meterRegistry)
                .increment();
    }

    public void recordRiskDecision(String outcome, String reason) {
        Counter.builder("risk_decisions_total")
                .tag("outcome", outcome)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void updatePerformance(double equityValue, double pnl, double drawdownPercent) {
        equity.set(equityValue);
        totalPnl.set(pnl);
        drawdownCurrent.set(drawdownPercent);
    }

    public long ordersPlaced() {
        return ordersPlaced.get();
    }

    public long exchangeFailures() {
        return exchangeFailures.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
