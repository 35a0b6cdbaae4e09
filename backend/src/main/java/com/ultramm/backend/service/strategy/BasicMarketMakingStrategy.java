package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.MarketView;
import com.ultramm.backend.model.PositionSnapshot;
import com.ultramm.backend.model.Signal;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Quotes a fixed percentage spread around mid.
 * bid = mid * (1 - spreadBid / 200), ask = mid * (1 + spreadAsk / 200).
 */
@Slf4j
public class BasicMarketMakingStrategy implements SymbolStrategy {

    public record Parameters(
            double spreadBidPercent,
            double spreadAskPercent,
            double minProfitPercent,
            double orderSize,
            double maxPosition,
            Duration refreshRate
    ) {}

    private final String id;
    private final List<String> symbols;
    protected final Parameters parameters;

    public BasicMarketMakingStrategy(String id, List<String> symbols, Parameters parameters) {
        this.id = id;
        this.symbols = List.copyOf(symbols);
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MARKET_MAKING;
    }

    @Override
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public Duration refreshInterval() {
        return parameters.refreshRate();
    }

    public Parameters parameters() {
        return parameters;
    }

    @Override
    public Optional<Signal> evaluate(String symbol, MarketView view, PositionSnapshot position) {
        if (atPositionLimit(symbol, position)) {
            return Optional.empty();
        }
        double mid = view.midPrice();
        if (mid <= 0) {
            return Optional.empty();
        }
        return Optional.of(quote(symbol, mid, parameters.spreadBidPercent(), parameters.spreadAskPercent(),
                parameters.orderSize(), "fixed spread"));
    }

    protected boolean atPositionLimit(String symbol, PositionSnapshot position) {
        if (Math.abs(position.quantity()) >= parameters.maxPosition()) {
            log.debug("{} suppressed for {}: position {} at limit {}", id, symbol, position.quantity(),
                    parameters.maxPosition());
            return true;
        }
        return false;
    }

    protected Signal quote(String symbol, double mid, double bidPercent, double askPercent, double size, String reason) {
        double total = bidPercent + askPercent;
        if (total < parameters.minProfitPercent()) {
            double scale = parameters.minProfitPercent() / total;
            bidPercent *= scale;
            askPercent *= scale;
        }
        double bid = mid * (1.0 - bidPercent / 200.0);
        double ask = mid * (1.0 + askPercent / 200.0);
        return Signal.quote(id, symbol, bid, ask, size, 1.0, mid, reason);
    }
}
