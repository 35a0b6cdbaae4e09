package com.ultramm.backend.service.exchange;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Port to one exchange. Implementations must treat a repeated {@code clientOrderId} as the same
 * order so a retried placement never creates a duplicate.
 * <p>
 * {@link com.ultramm.backend.exception.ExecutionTransientException} signals a failure worth
 * retrying, {@link com.ultramm.backend.exception.ExecutionFatalException} one that is not.
 */
public interface ExchangeConnector {

    String id();

    void subscribe(String symbol, MarketEventListener listener);

    void setExecutionListener(ExecutionReportListener listener);

    OrderAck placeOrder(OrderRequest request);

    OrderAck cancelOrder(String symbol, String exchangeOrderId);

    List<ExchangeOrder> getOpenOrders();

    Map<String, BigDecimal> getBalances();
}
