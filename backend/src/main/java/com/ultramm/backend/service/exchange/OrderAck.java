package com.ultramm.backend.service.exchange;

import java.time.Instant;

public record OrderAck(
        String clientOrderId,
        String exchangeOrderId,
        Instant acknowledgedAt
) {}
