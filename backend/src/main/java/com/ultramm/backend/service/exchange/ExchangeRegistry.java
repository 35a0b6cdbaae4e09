package com.ultramm.backend.service.exchange;

import com.ultramm.backend.config.MarketsProperties;
import com.ultramm.backend.exception.ConfigValidationException;
import com.ultramm.backend.exception.TradingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the connector responsible for a symbol.
 */
@Component
@Slf4j
public class ExchangeRegistry {

    private final Map<String, ExchangeConnector> connectors = new LinkedHashMap<>();
    private final MarketsProperties marketsProperties;

    public ExchangeRegistry(List<ExchangeConnector> connectors, MarketsProperties marketsProperties) {
        this.marketsProperties = marketsProperties;
        for (ExchangeConnector connector : connectors) {
            this.connectors.put(connector.id(), connector);
        }
        List<String> problems = new ArrayList<>();
        for (String symbol : marketsProperties.getSymbols()) {
            String exchangeId = marketsProperties.exchangeFor(symbol);
            if (!this.connectors.containsKey(exchangeId)) {
                problems.add("symbol " + symbol + " maps to unknown exchange '" + exchangeId + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigValidationException(problems);
        }
        log.info("Exchange connectors registered: {}", this.connectors.keySet());
    }

    public String exchangeIdFor(String symbol) {
        return marketsProperties.exchangeFor(symbol);
    }

    public ExchangeConnector connectorFor(String symbol) {
        return connector(exchangeIdFor(symbol));
    }

    public ExchangeConnector connector(String exchangeId) {
        ExchangeConnector connector = connectors.get(exchangeId);
        if (connector == null) {
            throw new TradingException("Unknown exchange: " + exchangeId);
        }
        return connector;
    }

    public Collection<ExchangeConnector> all() {
        return connectors.values();
    }
}
