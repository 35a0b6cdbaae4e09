package com.ultramm.backend.service.exchange;

import com.ultramm.backend.model.OrderType;
import com.ultramm.backend.model.Side;

public record OrderRequest(
        String clientOrderId,
        String symbol,
        Side side,
        OrderType type,
        double price,
        double size
) {}
