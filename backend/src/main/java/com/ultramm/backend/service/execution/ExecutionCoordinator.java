package com.ultramm.backend.service.execution;

import com.ultramm.backend.config.ExecutionProperties;
import com.ultramm.backend.dto.ExecutionStats;
import com.ultramm.backend.event.ExchangeHaltedEvent;
import com.ultramm.backend.event.FillEvent;
import com.ultramm.backend.event.OrderStateChangedEvent;
import com.ultramm.backend.event.TradingHaltedEvent;
import com.ultramm.backend.exception.ExecutionFatalException;
import com.ultramm.backend.exception.ExecutionTransientException;
import com.ultramm.backend.exception.TradingException;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.Order;
import com.ultramm.backend.model.OrderLeg;
import com.ultramm.backend.model.OrderState;
import com.ultramm.backend.model.OrderTransition;
import com.ultramm.backend.model.RiskDecision;
import com.ultramm.backend.model.Side;
import com.ultramm.backend.service.MetricsService;
import com.ultramm.backend.service.exchange.ExchangeConnector;
import com.ultramm.backend.service.exchange.ExchangeOrder;
import com.ultramm.backend.service.exchange.ExchangeRegistry;
import com.ultramm.backend.service.exchange.ExecutionReport;
import com.ultramm.backend.service.exchange.OrderAck;
import com.ultramm.backend.service.exchange.OrderRequest;
import com.ultramm.backend.service.marketdata.MarketDataCache;
import com.ultramm.backend.service.risk.OpenOrderView;
import com.ultramm.backend.service.risk.SuspensionRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.Supplier;

/**
 * Turns approved risk decisions into exchange orders and owns every order's lifecycle.
 * <p>
 * Placement is retried on transient failures with a fixed delay and each exchange call is
 * bounded by the call timeout. Fills arrive asynchronously as execution reports and are the only
 * path that changes positions. Each order is mutated under its own monitor; exchange calls are
 * never made while holding one.
 */
@Service
@Slf4j
public class ExecutionCoordinator implements OpenOrderView {

    private static final double EPSILON = 1e-12;

    private final ExchangeRegistry exchangeRegistry;
    private final ExecutionProperties executionProperties;
    private final PositionBook positionBook;
    private final MarketDataCache marketDataCache;
    private final SuspensionRegistry suspensionRegistry;
    private final MetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final RetryConfig orderRetryConfig;
    private final Executor exchangeCallExecutor;
    private final Executor followUpExecutor;

    private final ConcurrentHashMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<Double>> pendingSlices = new ConcurrentHashMap<>();
    private final Set<String> haltedExchanges = ConcurrentHashMap.newKeySet();
    private final Set<String> closedSymbols = ConcurrentHashMap.newKeySet();

    private final AtomicLong placedCount = new AtomicLong();
    private final AtomicLong filledCount = new AtomicLong();
    private final AtomicLong canceledCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong expiredCount = new AtomicLong();
    private final AtomicLong latencyTotalMillis = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();
    private final DoubleAdder filledVolume = new DoubleAdder();

    public ExecutionCoordinator(ExchangeRegistry exchangeRegistry,
                                ExecutionProperties executionProperties,
                                PositionBook positionBook,
                                MarketDataCache marketDataCache,
                                SuspensionRegistry suspensionRegistry,
                                MetricsService metricsService,
                                ApplicationEventPublisher eventPublisher,
                                Clock clock,
                                RetryConfig orderRetryConfig,
                                @Qualifier("exchangeCallExecutor") Executor exchangeCallExecutor,
                                @Qualifier("tradingScheduler") Executor followUpExecutor) {
        this.exchangeRegistry = exchangeRegistry;
        this.executionProperties = executionProperties;
        this.positionBook = positionBook;
        this.marketDataCache = marketDataCache;
        this.suspensionRegistry = suspensionRegistry;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.orderRetryConfig = orderRetryConfig;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.followUpExecutor = followUpExecutor;
    }

    @PostConstruct
    void registerExecutionListeners() {
        for (ExchangeConnector connector : exchangeRegistry.all()) {
            connector.setExecutionListener(this::onExecutionReport);
        }
    }

    // -------------------- submission --------------------

    public OrderHandle submit(RiskDecision decision) {
        if (!decision.isApproved()) {
            return OrderHandle.empty(decision.symbol());
        }
        String symbol = decision.symbol();
        String exchangeId = exchangeRegistry.exchangeIdFor(symbol);
        List<String> placed = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        for (OrderLeg leg : decision.legs()) {
            if (decision.isQuote()) {
                Optional<Order> live = refreshQuote(symbol, leg);
                if (live.isPresent()) {
                    kept.add(live.get().getId());
                    continue;
                }
            }
            Order order = createOrder(symbol, exchangeId, leg.side(), leg.price(), leg.size(), decision.isQuote(),
                    null, null);
            placed.add(order.getId());
            if (executionProperties.isUseIcebergOrders() && leg.size() > executionProperties.getIcebergThreshold()) {
                placeIceberg(order);
            } else {
                submitOrder(order);
            }
        }
        return new OrderHandle(symbol, placed, kept);
    }

    /**
     * Keeps one live quote on the leg's side if its price is within the refresh threshold and
     * cancels every other live quote on that side.
     */
    private Optional<Order> refreshQuote(String symbol, OrderLeg leg) {
        Order keep = null;
        for (Order live : workingOrders(symbol)) {
            if (!live.isQuote() || live.getParentId() != null || live.getSide() != leg.side()) {
                continue;
            }
            double distance = Math.abs(live.getPrice() - leg.price()) / leg.price() * 100.0;
            if (keep == null && distance <= executionProperties.getQuoteRefreshThresholdPercent()) {
                keep = live;
            } else {
                cancel(live, "quote refresh");
            }
        }
        return Optional.ofNullable(keep);
    }

    private Order createOrder(String symbol, String exchangeId, Side side, double price, double size, boolean quote,
                              String parentId, String replacesOrderId) {
        Instant now = clock.instant();
        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .parentId(parentId)
                .replacesOrderId(replacesOrderId)
                .exchangeId(exchangeId)
                .symbol(symbol)
                .side(side)
                .type(executionProperties.getOrderType())
                .price(price)
                .size(size)
                .quote(quote)
                .createdAt(now)
                .updatedAt(now)
                .build();
        orders.put(order.getId(), order);
        return order;
    }

    private void placeIceberg(Order parent) {
        Deque<Double> slices = new ArrayDeque<>(IcebergSlicer.slice(parent.getSize(),
                executionProperties.getIcebergVisibleFraction()));
        Order first;
        synchronized (parent) {
            parent.setIceberg(true);
            first = createOrder(parent.getSymbol(), parent.getExchangeId(), parent.getSide(), parent.getPrice(),
                    slices.poll(), parent.isQuote(), parent.getId(), null);
            pendingSlices.put(parent.getId(), slices);
            transition(parent, OrderState.SUBMITTED, "iceberg working, " + (slices.size() + 1) + " slices");
        }
        log.info("Iceberg {} {} {} split into {} slices", parent.getId(), parent.getSide(), parent.getSize(),
                slices.size() + 1);
        submitOrder(first);
    }

    void submitOrder(Order order) {
        String exchangeId = order.getExchangeId();
        if (haltedExchanges.contains(exchangeId)) {
            reject(order, "exchange " + exchangeId + " halted");
            return;
        }
        if (closedSymbols.contains(order.getSymbol())) {
            withdraw(order, "symbol " + order.getSymbol() + " closed");
            return;
        }
        MDC.put("orderId", order.getId());
        MDC.put("symbol", order.getSymbol());
        try {
            ExchangeConnector connector = exchangeRegistry.connector(exchangeId);
            OrderRequest request = new OrderRequest(order.getId(), order.getSymbol(), order.getSide(), order.getType(),
                    order.getPrice(), order.getSize());
            Retry retry = Retry.of("place-" + order.getId(), orderRetryConfig);
            retry.getEventPublisher().onRetry(event -> {
                synchronized (order) {
                    order.incrementRetryCount();
                }
                log.warn("Retrying order {} (attempt {}): {}", order.getId(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            });
            Instant started = clock.instant();
            OrderAck ack = Retry.decorateSupplier(retry, () -> callExchange(() -> connector.placeOrder(request))).get();
            recordLatency(Duration.between(started, clock.instant()));
            placedCount.incrementAndGet();
            metricsService.incrementOrdersPlaced();
            boolean closedBeforeAck;
            synchronized (order) {
                if (order.getExchangeOrderId() == null) {
                    order.setExchangeOrderId(ack.exchangeOrderId());
                }
                closedBeforeAck = order.isTerminal();
                if (order.getState() == OrderState.NEW) {
                    transition(order, OrderState.SUBMITTED, "acknowledged");
                }
            }
            if (closedBeforeAck) {
                log.warn("Order {} was closed before its acknowledgement, canceling on {}", order.getId(), exchangeId);
                callExchange(() -> connector.cancelOrder(order.getSymbol(), ack.exchangeOrderId()));
                return;
            }
            log.info("Order {} {} {} @ {} submitted to {}", order.getSide(), order.getSize(), order.getSymbol(),
                    order.getPrice(), exchangeId);
        } catch (ExecutionFatalException e) {
            haltExchange(exchangeId, e.getMessage());
            reject(order, "fatal: " + e.getMessage());
        } catch (ExecutionTransientException e) {
            metricsService.incrementExchangeFailures();
            reject(order, "retries exhausted: " + e.getMessage());
        } catch (TradingException e) {
            metricsService.incrementExchangeFailures();
            reject(order, e.getMessage());
        } finally {
            MDC.remove("orderId");
            MDC.remove("symbol");
        }
    }

    private void reject(Order order, String reason) {
        boolean changed;
        synchronized (order) {
            changed = !order.isTerminal() && order.canTransitionTo(OrderState.REJECTED);
            if (changed) {
                transition(order, OrderState.REJECTED, reason);
            }
        }
        if (changed) {
            log.error("Order {} for {} rejected: {}", order.getId(), order.getSymbol(), reason);
            metricsService.recordReject(reason.startsWith("retries exhausted") ? "RETRIES_EXHAUSTED" : "EXCHANGE");
            afterTerminal(order);
        }
    }

    private void withdraw(Order order, String reason) {
        boolean changed;
        synchronized (order) {
            changed = order.getState() == OrderState.NEW;
            if (changed) {
                transition(order, OrderState.CANCELED, reason + ", never sent");
            }
        }
        if (changed) {
            log.info("Order {} withdrawn: {}", order.getId(), reason);
            afterTerminal(order);
        }
    }

    /**
     * Runs {@code call} on the exchange executor and waits at most the call timeout.
     * Timeouts and unexpected failures surface as {@link ExecutionTransientException}.
     */
    <T> T callExchange(Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, exchangeCallExecutor);
        long timeoutMillis = executionProperties.getCallTimeout().toMillis();
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExecutionTransientException("Exchange call timed out after " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionTransientException("Interrupted while waiting for exchange", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TradingException tradingException) {
                throw tradingException;
            }
            throw new ExecutionTransientException("Exchange call failed: " + cause.getMessage(), cause);
        }
    }

    // -------------------- execution reports --------------------

    public void onExecutionReport(ExecutionReport report) {
        Order order = orders.get(report.clientOrderId());
        if (order == null) {
            log.warn("Execution report {} for unknown order {}", report.type(), report.clientOrderId());
            return;
        }
        MDC.put("orderId", order.getId());
        MDC.put("symbol", order.getSymbol());
        try {
            double applied = 0.0;
            boolean terminal;
            synchronized (order) {
                if (order.isTerminal()) {
                    log.debug("Ignoring {} for terminal order {}", report.type(), order.getId());
                    return;
                }
                if (order.getExchangeOrderId() == null) {
                    order.setExchangeOrderId(report.exchangeOrderId());
                }
                switch (report.type()) {
                    case ACK -> {
                        if (order.getState() == OrderState.NEW) {
                            transition(order, OrderState.SUBMITTED, "acknowledged");
                        }
                    }
                    case PARTIAL_FILL, FILL -> applied = applyFill(order, report);
                    case CANCELED -> applyReportedState(order,
                            order.isExpiring() ? OrderState.EXPIRED : OrderState.CANCELED,
                            report.reason() != null ? report.reason() : "canceled");
                    case REJECTED -> {
                        if (applyReportedState(order, OrderState.REJECTED, report.reason())) {
                            metricsService.recordReject("EXCHANGE");
                        }
                    }
                    case EXPIRED -> applyReportedState(order, OrderState.EXPIRED, report.reason());
                }
                terminal = order.isTerminal();
            }
            if (order.getParentId() != null && (applied > 0 || terminal)) {
                onChildUpdate(order, applied, report.lastPrice(), terminal);
            } else if (terminal) {
                afterTerminal(order);
            }
        } finally {
            MDC.remove("orderId");
            MDC.remove("symbol");
        }
    }

    /**
     * Caller holds the order's monitor. Reports the state machine does not allow are logged and dropped.
     */
    private boolean applyReportedState(Order order, OrderState target, String reason) {
        if (order.getState() == OrderState.NEW && target == OrderState.EXPIRED) {
            transition(order, OrderState.SUBMITTED, "acknowledged by expiry");
        }
        if (!order.canTransitionTo(target)) {
            log.warn("Dropping {} report for order {} in state {}", target, order.getId(), order.getState());
            return false;
        }
        transition(order, target, reason);
        return true;
    }

    private double applyFill(Order order, ExecutionReport report) {
        if (order.getState() == OrderState.NEW) {
            transition(order, OrderState.SUBMITTED, "acknowledged by fill");
        }
        double applied = order.applyFill(report.lastQuantity(), report.lastPrice());
        if (applied <= 0) {
            return 0.0;
        }
        double fee = applied * report.lastPrice() * executionProperties.getFeeRate();
        PositionBook.PositionChange change = positionBook.applyFill(order.getSymbol(), order.getSide(), applied,
                report.lastPrice(), fee);
        filledVolume.add(applied * report.lastPrice());
        transition(order, order.isFullyFilled() ? OrderState.FILLED : OrderState.PARTIALLY_FILLED,
                String.format("filled %.8f @ %.8f", applied, report.lastPrice()));
        eventPublisher.publishEvent(new FillEvent(order.getId(), order.getSymbol(), order.getSide(), applied,
                report.lastPrice(), fee, change.realizedPnlDelta(), change.current(), clock.instant()));
        log.info("Fill {} {} {} @ {}, position now {}", order.getSide(), applied, order.getSymbol(),
                report.lastPrice(), change.current().quantity());
        return applied;
    }

    /**
     * Folds a child's fill into its iceberg parent and releases the next slice once the child is filled.
     */
    private void onChildUpdate(Order child, double applied, double price, boolean childTerminal) {
        Order parent = orders.get(child.getParentId());
        if (parent == null) {
            return;
        }
        Order next = null;
        synchronized (parent) {
            if (parent.isTerminal()) {
                return;
            }
            if (applied > 0) {
                parent.applyFill(applied, price);
                transition(parent, parent.isFullyFilled() ? OrderState.FILLED : OrderState.PARTIALLY_FILLED,
                        "slice " + child.getId() + " filled " + applied);
            }
            if (childTerminal && !parent.isTerminal()) {
                OrderState childState = child.getState();
                Deque<Double> slices = pendingSlices.get(parent.getId());
                if (childState == OrderState.FILLED && slices != null && !slices.isEmpty()) {
                    next = createOrder(parent.getSymbol(), parent.getExchangeId(), parent.getSide(), parent.getPrice(),
                            slices.poll(), parent.isQuote(), parent.getId(), null);
                } else if (childState == OrderState.CANCELED || childState == OrderState.REJECTED) {
                    pendingSlices.remove(parent.getId());
                    closeParent(parent, childState, "slice " + child.getId() + " " + childState);
                }
            }
            if (parent.isTerminal()) {
                pendingSlices.remove(parent.getId());
            }
        }
        if (next != null) {
            Order slice = next;
            followUpExecutor.execute(() -> submitOrder(slice));
        }
        if (childTerminal && child.getState() == OrderState.EXPIRED) {
            afterTerminal(child);
        }
    }

    private void closeParent(Order parent, OrderState childState, String reason) {
        OrderState target = childState == OrderState.REJECTED && parent.getFilledSize() <= EPSILON
                ? OrderState.REJECTED : OrderState.CANCELED;
        transition(parent, target, reason);
    }

    private void afterTerminal(Order order) {
        if (order.getParentId() != null && order.getState() != OrderState.EXPIRED) {
            onChildUpdate(order, 0.0, 0.0, true);
            return;
        }
        if (order.getState() == OrderState.EXPIRED) {
            // cancel reports can arrive on an exchange thread still inside cancelOrder
            followUpExecutor.execute(() -> resubmitExpired(order));
        }
    }

    // -------------------- aging and cancellation --------------------

    @Scheduled(fixedDelayString = "${execution.sweep-interval-ms:5000}")
    public void runScheduledSweep() {
        try {
            sweepAgedOrders();
            pruneHistory();
        } catch (RuntimeException e) {
            log.error("Order age sweep failed", e);
        }
    }

    /**
     * Cancels working orders older than the maximum order age. They end EXPIRED and the unfilled
     * remainder is resubmitted at a refreshed price when that price is within the slippage bound.
     */
    public int sweepAgedOrders() {
        Instant cutoff = clock.instant().minus(executionProperties.getMaxOrderAge());
        int expired = 0;
        for (Order order : List.copyOf(orders.values())) {
            boolean aged;
            synchronized (order) {
                aged = !order.isTerminal() && !order.isIceberg() && !order.isExpiring()
                        && order.getSubmittedAt() != null && order.getSubmittedAt().isBefore(cutoff);
                if (aged) {
                    order.setExpiring(true);
                }
            }
            if (aged) {
                log.info("Order {} exceeded max age {}", order.getId(), executionProperties.getMaxOrderAge());
                cancelLeaf(order, "max order age exceeded");
                expired++;
            }
        }
        return expired;
    }

    private void resubmitExpired(Order order) {
        String symbol = order.getSymbol();
        Order parent = order.getParentId() != null ? orders.get(order.getParentId()) : null;
        double remaining = order.remainingSize();
        String skipReason = null;
        double refreshed = 0.0;
        if (order.isQuote()) {
            skipReason = "quotes are refreshed by their strategy";
        } else if (remaining <= EPSILON) {
            skipReason = "nothing left to fill";
        } else if (closedSymbols.contains(symbol)) {
            skipReason = "symbol closed";
        } else if (haltedExchanges.contains(order.getExchangeId()) || suspensionRegistry.isGloballySuspended()
                || suspensionRegistry.isSuspended(symbol)) {
            skipReason = "trading suspended";
        } else {
            Optional<MarketSnapshot> snapshot = marketDataCache.peek(symbol);
            if (snapshot.isEmpty() || !snapshot.get().hasBook()) {
                skipReason = "no market data";
            } else {
                refreshed = order.getSide() == Side.BUY ? snapshot.get().bestAsk() : snapshot.get().bestBid();
                double adverse = (refreshed - order.getPrice()) / order.getPrice() * 100.0 * order.getSide().sign();
                if (adverse > executionProperties.getMaxSlippagePercent()) {
                    skipReason = String.format("refreshed price %.8f is %.4f%% beyond original", refreshed, adverse);
                }
            }
        }
        if (skipReason != null) {
            log.info("Not resubmitting expired order {}: {}", order.getId(), skipReason);
            if (parent != null) {
                synchronized (parent) {
                    if (!parent.isTerminal()) {
                        pendingSlices.remove(parent.getId());
                        closeParent(parent, OrderState.CANCELED, "slice " + order.getId() + " expired");
                    }
                }
            }
            return;
        }
        Order replacement = createOrder(symbol, order.getExchangeId(), order.getSide(), refreshed, remaining, false,
                order.getParentId(), order.getId());
        log.info("Resubmitting {} of expired order {} at {} as {}", remaining, order.getId(), refreshed,
                replacement.getId());
        submitOrder(replacement);
    }

    public void cancel(Order order, String reason) {
        if (order.isIceberg()) {
            cancelIceberg(order, reason);
        } else {
            cancelLeaf(order, reason);
        }
    }

    private void cancelIceberg(Order parent, String reason) {
        pendingSlices.remove(parent.getId());
        List<Order> children = orders.values().stream()
                .filter(order -> parent.getId().equals(order.getParentId()) && !order.isTerminal())
                .toList();
        if (children.isEmpty()) {
            synchronized (parent) {
                if (!parent.isTerminal()) {
                    transition(parent, OrderState.CANCELED, reason);
                }
            }
            return;
        }
        for (Order child : children) {
            cancelLeaf(child, reason);
        }
    }

    private void cancelLeaf(Order order, String reason) {
        String exchangeOrderId;
        synchronized (order) {
            if (order.isTerminal()) {
                return;
            }
            exchangeOrderId = order.getExchangeOrderId();
            if (exchangeOrderId == null) {
                transition(order, order.isExpiring() ? OrderState.EXPIRED : OrderState.CANCELED, reason + " before acknowledgement");
            }
        }
        if (exchangeOrderId == null) {
            afterTerminal(order);
            return;
        }
        try {
            ExchangeConnector connector = exchangeRegistry.connector(order.getExchangeId());
            callExchange(() -> connector.cancelOrder(order.getSymbol(), exchangeOrderId));
        } catch (TradingException e) {
            metricsService.incrementExchangeFailures();
            log.warn("Cancel of order {} ({}) failed: {}", order.getId(), reason, e.getMessage());
        }
    }

    public int cancelOpenOrders(String symbol, String reason) {
        List<Order> targets = workingOrders(symbol).stream().filter(order -> order.getParentId() == null).toList();
        targets.forEach(order -> cancel(order, reason));
        if (!targets.isEmpty()) {
            log.info("Canceled {} open orders for {}: {}", targets.size(), symbol, reason);
        }
        return targets.size();
    }

    public int cancelAll(String reason) {
        List<Order> targets = orders.values().stream()
                .filter(order -> !order.isTerminal() && order.getParentId() == null)
                .toList();
        targets.forEach(order -> cancel(order, reason));
        log.warn("Canceled all {} open orders: {}", targets.size(), reason);
        return targets.size();
    }

    @EventListener
    public void onTradingHalted(TradingHaltedEvent event) {
        cancelAll("trading halted: " + event.reason());
    }

    /**
     * Waits for every order of {@code symbol} to reach a terminal state. Orders still working when
     * the timeout elapses are closed locally as CANCELED and reported.
     *
     * @return true when every order terminated on its own
     */
    public boolean awaitTerminal(String symbol, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        while (!workingOrders(symbol).isEmpty() && clock.instant().isBefore(deadline)) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        List<Order> remaining = workingOrders(symbol);
        for (Order order : remaining) {
            synchronized (order) {
                if (!order.isTerminal()) {
                    transition(order, OrderState.CANCELED, "unconfirmed at stop");
                }
            }
            log.error("Order {} for {} not confirmed terminal within {}, closed locally", order.getId(), symbol, timeout);
        }
        return remaining.isEmpty();
    }

    /**
     * Stops every placement for {@code symbol}, including resubmission of expired orders and
     * release of iceberg slices. Called before the symbol's open orders are canceled.
     */
    public void closeSymbol(String symbol) {
        if (closedSymbols.add(symbol)) {
            log.info("Order placement closed for {}", symbol);
        }
    }

    public void openSymbol(String symbol) {
        if (closedSymbols.remove(symbol)) {
            log.info("Order placement reopened for {}", symbol);
        }
    }

    public boolean isClosed(String symbol) {
        return closedSymbols.contains(symbol);
    }

    // -------------------- halting and reconciliation --------------------

    public void haltExchange(String exchangeId, String reason) {
        if (haltedExchanges.add(exchangeId)) {
            log.error("Exchange {} halted: {}", exchangeId, reason);
            metricsService.recordHalt();
            eventPublisher.publishEvent(new ExchangeHaltedEvent(exchangeId, reason, clock.instant()));
        }
    }

    public void resumeExchange(String exchangeId) {
        if (haltedExchanges.remove(exchangeId)) {
            log.warn("Exchange {} resumed", exchangeId);
        }
    }

    public boolean isHalted(String exchangeId) {
        return haltedExchanges.contains(exchangeId);
    }

    public Set<String> haltedExchanges() {
        return Set.copyOf(haltedExchanges);
    }

    @Scheduled(fixedDelayString = "${execution.reconcile-interval-ms:30000}")
    public void runScheduledReconciliation() {
        try {
            ReconcileReport report = reconcile();
            if (report.hasMismatch()) {
                log.warn("Reconciliation mismatches: unknown={} missing={} fills={}", report.unknownOrders(),
                        report.missingOrders(), report.fillMismatches());
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation task failed", e);
        }
    }

    /**
     * Compares local working orders with each exchange's open orders. Exchange orders unknown
     * locally are canceled, missed fills are applied, and local orders the exchange no longer
     * lists are closed.
     */
    public ReconcileReport reconcile() {
        List<String> unknown = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> fills = new ArrayList<>();
        int checked = 0;
        Instant settled = clock.instant().minus(executionProperties.getCallTimeout());
        for (ExchangeConnector connector : exchangeRegistry.all()) {
            if (haltedExchanges.contains(connector.id())) {
                continue;
            }
            List<ExchangeOrder> remote;
            try {
                remote = callExchange(connector::getOpenOrders);
            } catch (TradingException e) {
                log.warn("Reconciliation skipped for {}: {}", connector.id(), e.getMessage());
                continue;
            }
            checked += remote.size();
            Map<String, ExchangeOrder> remoteByClientId = new HashMap<>();
            for (ExchangeOrder exchangeOrder : remote) {
                remoteByClientId.put(exchangeOrder.clientOrderId(), exchangeOrder);
                Order local = orders.get(exchangeOrder.clientOrderId());
                if (local == null || local.isTerminal()) {
                    unknown.add(exchangeOrder.exchangeOrderId());
                    cancelRemote(connector, exchangeOrder);
                } else if (exchangeOrder.filledSize() > local.getFilledSize() + EPSILON) {
                    double missed = exchangeOrder.filledSize() - local.getFilledSize();
                    fills.add(local.getId());
                    onExecutionReport(new ExecutionReport(ExecutionReport.Type.PARTIAL_FILL, local.getId(),
                            exchangeOrder.exchangeOrderId(), local.getSymbol(), missed,
                            exchangeOrder.averageFillPrice(), "reconciliation", clock.instant()));
                }
            }
            for (Order local : List.copyOf(orders.values())) {
                if (!connector.id().equals(local.getExchangeId()) || local.isIceberg()
                        || remoteByClientId.containsKey(local.getId())) {
                    continue;
                }
                boolean closed = false;
                synchronized (local) {
                    if (!local.isTerminal() && local.getExchangeOrderId() != null && local.getSubmittedAt() != null
                            && local.getSubmittedAt().isBefore(settled)) {
                        transition(local, OrderState.CANCELED, "missing on exchange during reconciliation");
                        closed = true;
                    }
                }
                if (closed) {
                    missing.add(local.getId());
                    log.error("Order {} missing on {}, closed locally", local.getId(), connector.id());
                    afterTerminal(local);
                }
            }
        }
        return new ReconcileReport(checked, unknown, missing, fills, clock.instant());
    }

    private void cancelRemote(ExchangeConnector connector, ExchangeOrder exchangeOrder) {
        try {
            callExchange(() -> connector.cancelOrder(exchangeOrder.symbol(), exchangeOrder.exchangeOrderId()));
            log.warn("Canceled untracked order {} on {}", exchangeOrder.exchangeOrderId(), connector.id());
        } catch (TradingException e) {
            log.warn("Could not cancel untracked order {}: {}", exchangeOrder.exchangeOrderId(), e.getMessage());
        }
    }

    private void pruneHistory() {
        Instant cutoff = clock.instant().minus(executionProperties.getHistoryRetention());
        orders.values().removeIf(order -> order.isTerminal() && order.getUpdatedAt() != null
                && order.getUpdatedAt().isBefore(cutoff));
    }

    // -------------------- views --------------------

    @Override
    public int openOrderCount(String symbol) {
        return (int) orders.values().stream()
                .filter(order -> symbol.equals(order.getSymbol()) && order.getParentId() == null && !order.isTerminal())
                .count();
    }

    @Override
    public double pendingExposure(String symbol, Side side) {
        double exposure = 0.0;
        for (Order order : orders.values()) {
            if (symbol.equals(order.getSymbol()) && order.getParentId() == null && order.getSide() == side
                    && !order.isTerminal()) {
                exposure += order.remainingSize();
            }
        }
        return exposure;
    }

    public List<Order> workingOrders(String symbol) {
        return orders.values().stream()
                .filter(order -> symbol.equals(order.getSymbol()) && !order.isTerminal())
                .toList();
    }

    public Optional<Order> order(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<OrderTransition> history(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            return List.of();
        }
        synchronized (order) {
            return List.copyOf(order.getHistory());
        }
    }

    public ExecutionStats stats() {
        long samples = latencySamples.get();
        return new ExecutionStats(
                placedCount.get(),
                filledCount.get(),
                canceledCount.get(),
                rejectedCount.get(),
                expiredCount.get(),
                filledVolume.sum(),
                samples == 0 ? 0.0 : latencyTotalMillis.get() / (double) samples
        );
    }

    private void recordLatency(Duration latency) {
        latencyTotalMillis.addAndGet(latency.toMillis());
        latencySamples.incrementAndGet();
        metricsService.recordSubmitLatency(latency);
    }

    /**
     * Caller holds the order's monitor.
     */
    private void transition(Order order, OrderState target, String reason) {
        OrderState from = order.getState();
        OrderTransition transition = order.transitionTo(target, reason, clock.instant());
        switch (target) {
            case FILLED -> {
                if (!order.isIceberg()) {
                    filledCount.incrementAndGet();
                    metricsService.recordOrderFilled();
                }
            }
            case CANCELED -> canceledCount.incrementAndGet();
            case REJECTED -> rejectedCount.incrementAndGet();
            case EXPIRED -> expiredCount.incrementAndGet();
            default -> {
            }
        }
        eventPublisher.publishEvent(new OrderStateChangedEvent(order.getId(), order.getParentId(), order.getSymbol(),
                from, target, reason, transition.at()));
    }
}
