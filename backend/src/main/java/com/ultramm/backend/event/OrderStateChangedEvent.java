package com.ultramm.backend.event;

import com.ultramm.backend.model.OrderState;

import java.time.Instant;

public record OrderStateChangedEvent(
        String orderId,
        String parentId,
        String symbol,
        OrderState from,
        OrderState to,
        String reason,
        Instant at
) {}
