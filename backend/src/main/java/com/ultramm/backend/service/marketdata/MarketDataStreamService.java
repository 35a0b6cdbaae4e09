package com.ultramm.backend.service.marketdata;

import com.ultramm.backend.model.MarketEvent;
import com.ultramm.backend.service.exchange.ExchangeConnector;
import com.ultramm.backend.service.exchange.ExchangeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscribes traded symbols on their exchange and routes every market event into the cache.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketDataStreamService {

    private final ExchangeRegistry exchangeRegistry;
    private final MarketDataCache marketDataCache;
    private final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    private final AtomicLong acceptedEvents = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();

    public void subscribeAll(Collection<String> symbols) {
        symbols.forEach(this::subscribe);
    }

    public void subscribe(String symbol) {
        if (!subscribed.add(symbol)) {
            return;
        }
        ExchangeConnector connector = exchangeRegistry.connectorFor(symbol);
        connector.subscribe(symbol, this::onMarketEvent);
        log.info("Subscribed {} on {}", symbol, connector.id());
    }

    void onMarketEvent(MarketEvent event) {
        try {
            if (marketDataCache.update(event)) {
                acceptedEvents.incrementAndGet();
            } else {
                droppedEvents.incrementAndGet();
            }
        } catch (RuntimeException e) {
            droppedEvents.incrementAndGet();
            log.error("Failed to apply market event for {}", event.symbol(), e);
        }
    }

    public boolean isSubscribed(String symbol) {
        return subscribed.contains(symbol);
    }

    public long acceptedEvents() {
        return acceptedEvents.get();
    }

    public long droppedEvents() {
        return droppedEvents.get();
    }
}
