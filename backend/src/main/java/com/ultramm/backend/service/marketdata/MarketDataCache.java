package com.ultramm.backend.service.marketdata;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.exception.DataStaleException;
import com.ultramm.backend.model.MarketEvent;
import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.model.MarketView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest snapshot and rolling indicators per symbol. Each symbol has its own lock, so updates
 * and reads for one symbol never wait on another.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketDataCache {

    private final DataProperties dataProperties;
    private final Clock clock;
    private final ConcurrentHashMap<String, SymbolMarketState> states = new ConcurrentHashMap<>();

    /**
     * Applies a raw exchange event. Invalid or out-of-order events leave the symbol untouched.
     *
     * @return true when the event changed the symbol's state
     */
    public boolean update(MarketEvent event) {
        if (event == null || event.symbol() == null || event.timestamp() == null) {
            log.warn("Ignoring malformed market event {}", event);
            return false;
        }
        SymbolMarketState state = states.computeIfAbsent(event.symbol(),
                symbol -> new SymbolMarketState(symbol, dataProperties));
        state.lock().lock();
        try {
            return state.apply(event);
        } finally {
            state.lock().unlock();
        }
    }

    /**
     * Snapshot and indicators for {@code symbol}, read together.
     *
     * @throws DataStaleException when the symbol has no data or its snapshot is older than the cache expiry
     */
    public MarketView read(String symbol) {
        SymbolMarketState state = states.get(symbol);
        if (state == null) {
            throw new DataStaleException(symbol, "No market data for " + symbol);
        }
        state.lock().lock();
        try {
            MarketSnapshot snapshot = state.snapshot();
            if (snapshot == null) {
                throw new DataStaleException(symbol, "No market data for " + symbol);
            }
            Duration age = snapshot.ageAt(clock.instant());
            if (age.compareTo(dataProperties.getCacheExpiry()) > 0) {
                throw new DataStaleException(symbol, "Market data for " + symbol + " is " + age.toMillis() + "ms old");
            }
            return new MarketView(snapshot, state.indicators());
        } finally {
            state.lock().unlock();
        }
    }

    /**
     * Latest snapshot regardless of age, for marking positions and re-pricing orders.
     */
    public Optional<MarketSnapshot> peek(String symbol) {
        SymbolMarketState state = states.get(symbol);
        if (state == null) {
            return Optional.empty();
        }
        state.lock().lock();
        try {
            return Optional.ofNullable(state.snapshot());
        } finally {
            state.lock().unlock();
        }
    }

    public Set<String> symbols() {
        return Set.copyOf(states.keySet());
    }
}
