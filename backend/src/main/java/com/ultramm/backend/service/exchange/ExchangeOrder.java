package com.ultramm.backend.service.exchange;

import com.ultramm.backend.model.Side;

/**
 * An open order as the exchange reports it.
 */
public record ExchangeOrder(
        String clientOrderId,
        String exchangeOrderId,
        String symbol,
        Side side,
        double price,
        double size,
        double filledSize,
        double averageFillPrice
) {}
