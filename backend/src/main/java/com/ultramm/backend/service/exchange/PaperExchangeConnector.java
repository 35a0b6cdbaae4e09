package com.ultramm.backend.service.exchange;

import com.ultramm.backend.config.MarketsProperties;
import com.ultramm.backend.exception.TradingException;
import com.ultramm.backend.model.DepthEvent;
import com.ultramm.backend.model.DepthLevel;
import com.ultramm.backend.model.MarketEvent;
import com.ultramm.backend.model.OrderType;
import com.ultramm.backend.model.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory exchange used for simulation and paper trading. Orders match against the last
 * depth update it has seen, limited to the quantity at the best level, so large orders fill
 * over several updates.
 */
@Component
@Slf4j
public class PaperExchangeConnector implements ExchangeConnector, MarketEventListener {

    public static final String EXCHANGE_ID = "paper";

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, List<MarketEventListener>> subscribers = new HashMap<>();
    private final Map<String, PaperOrder> ordersByClientId = new LinkedHashMap<>();
    private final Map<String, String> clientIdByExchangeId = new HashMap<>();
    private final Map<String, DepthEvent> books = new HashMap<>();
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final List<ExecutionReportListener> executionListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public PaperExchangeConnector(Clock clock, MarketsProperties marketsProperties) {
        this.clock = clock;
        this.balances.put(quoteAsset(marketsProperties.getSymbols().isEmpty()
                ? "BTC/USDT" : marketsProperties.getSymbols().get(0)),
                BigDecimal.valueOf(marketsProperties.getSimulation().getQuoteBalance()));
    }

    @Override
    public String id() {
        return EXCHANGE_ID;
    }

    @Override
    public void subscribe(String symbol, MarketEventListener listener) {
        synchronized (lock) {
            subscribers.computeIfAbsent(symbol, key -> new CopyOnWriteArrayList<>()).add(listener);
        }
        log.info("Paper exchange subscription added for {}", symbol);
    }

    @Override
    public void setExecutionListener(ExecutionReportListener listener) {
        executionListeners.add(listener);
    }

    /**
     * Entry point for the market feed: updates the book, matches resting orders, then forwards
     * the event to subscribers.
     */
    @Override
    public void onMarketEvent(MarketEvent event) {
        List<ExecutionReport> reports = new ArrayList<>();
        List<MarketEventListener> listeners;
        synchronized (lock) {
            if (event instanceof DepthEvent depth) {
                books.put(depth.symbol(), depth);
                for (PaperOrder order : ordersByClientId.values()) {
                    if (order.open && order.request.symbol().equals(depth.symbol())) {
                        match(order, reports);
                    }
                }
            }
            listeners = List.copyOf(subscribers.getOrDefault(event.symbol(), List.of()));
        }
        deliver(reports);
        for (MarketEventListener listener : listeners) {
            listener.onMarketEvent(event);
        }
    }

    @Override
    public OrderAck placeOrder(OrderRequest request) {
        List<ExecutionReport> reports = new ArrayList<>();
        OrderAck ack;
        synchronized (lock) {
            PaperOrder existing = ordersByClientId.get(request.clientOrderId());
            if (existing != null) {
                return existing.ack;
            }
            String exchangeOrderId = "PAPER-" + sequence.incrementAndGet();
            ack = new OrderAck(request.clientOrderId(), exchangeOrderId, clock.instant());
            PaperOrder order = new PaperOrder(request, ack);
            ordersByClientId.put(request.clientOrderId(), order);
            clientIdByExchangeId.put(exchangeOrderId, request.clientOrderId());

            String invalid = validate(request);
            if (invalid != null) {
                order.open = false;
                reports.add(report(ExecutionReport.Type.REJECTED, order, 0.0, 0.0, invalid));
            } else {
                match(order, reports);
                if (order.open && request.type() == OrderType.MARKET) {
                    order.open = false;
                    reports.add(report(ExecutionReport.Type.CANCELED, order, 0.0, 0.0, "no liquidity"));
                }
            }
        }
        deliver(reports);
        return ack;
    }

    @Override
    public OrderAck cancelOrder(String symbol, String exchangeOrderId) {
        List<ExecutionReport> reports = new ArrayList<>();
        OrderAck ack;
        synchronized (lock) {
            String clientOrderId = clientIdByExchangeId.get(exchangeOrderId);
            PaperOrder order = clientOrderId == null ? null : ordersByClientId.get(clientOrderId);
            if (order == null) {
                throw new TradingException("Unknown paper order " + exchangeOrderId);
            }
            if (order.open) {
                order.open = false;
                reports.add(report(ExecutionReport.Type.CANCELED, order, 0.0, 0.0, "canceled on request"));
            }
            ack = new OrderAck(clientOrderId, exchangeOrderId, clock.instant());
        }
        deliver(reports);
        return ack;
    }

    @Override
    public List<ExchangeOrder> getOpenOrders() {
        synchronized (lock) {
            return ordersByClientId.values().stream()
                    .filter(order -> order.open)
                    .map(order -> new ExchangeOrder(
                            order.request.clientOrderId(),
                            order.ack.exchangeOrderId(),
                            order.request.symbol(),
                            order.request.side(),
                            order.request.price(),
                            order.request.size(),
                            order.filled,
                            order.averagePrice))
                    .toList();
        }
    }

    @Override
    public Map<String, BigDecimal> getBalances() {
        synchronized (lock) {
            return Map.copyOf(balances);
        }
    }

    private String validate(OrderRequest request) {
        if (request.size() <= 0) {
            return "size must be positive";
        }
        if (request.type() == OrderType.LIMIT && request.price() <= 0) {
            return "limit price must be positive";
        }
        return null;
    }

    private void match(PaperOrder order, List<ExecutionReport> reports) {
        DepthEvent book = books.get(order.request.symbol());
        if (book == null || book.bids().isEmpty() || book.asks().isEmpty()) {
            return;
        }
        OrderRequest request = order.request;
        DepthLevel touch = request.side() == Side.BUY ? book.asks().get(0) : book.bids().get(0);
        boolean marketable = request.type() == OrderType.MARKET
                || (request.side() == Side.BUY ? request.price() >= touch.price() : request.price() <= touch.price());
        if (!marketable) {
            return;
        }
        double remaining = request.size() - order.filled;
        double quantity = Math.min(remaining, touch.quantity());
        if (quantity <= 0) {
            return;
        }
        double price = touch.price();
        order.averagePrice = (order.averagePrice * order.filled + price * quantity) / (order.filled + quantity);
        order.filled += quantity;
        settle(request, quantity, price);

        boolean complete = request.size() - order.filled <= 1e-12;
        if (complete) {
            order.open = false;
        }
        reports.add(report(complete ? ExecutionReport.Type.FILL : ExecutionReport.Type.PARTIAL_FILL,
                order, quantity, price, null));
    }

    private void settle(OrderRequest request, double quantity, double price) {
        BigDecimal baseDelta = BigDecimal.valueOf(request.side().sign() * quantity);
        BigDecimal quoteDelta = BigDecimal.valueOf(-request.side().sign() * quantity * price);
        balances.merge(baseAsset(request.symbol()), baseDelta, BigDecimal::add);
        balances.merge(quoteAsset(request.symbol()), quoteDelta, BigDecimal::add);
    }

    private ExecutionReport report(ExecutionReport.Type type, PaperOrder order, double quantity, double price,
                                   String reason) {
        return new ExecutionReport(type, order.request.clientOrderId(), order.ack.exchangeOrderId(),
                order.request.symbol(), quantity, price, reason, clock.instant());
    }

    private void deliver(List<ExecutionReport> reports) {
        for (ExecutionReport report : reports) {
            for (ExecutionReportListener listener : executionListeners) {
                listener.onExecutionReport(report);
            }
        }
    }

    private static String baseAsset(String symbol) {
        int slash = symbol.indexOf('/');
        return slash > 0 ? symbol.substring(0, slash) : symbol;
    }

    private static String quoteAsset(String symbol) {
        int slash = symbol.indexOf('/');
        return slash > 0 ? symbol.substring(slash + 1) : "QUOTE";
    }

    private static final class PaperOrder {
        private final OrderRequest request;
        private final OrderAck ack;
        private double filled;
        private double averagePrice;
        private boolean open = true;

        private PaperOrder(OrderRequest request, OrderAck ack) {
            this.request = request;
            this.ack = ack;
        }
    }
}
