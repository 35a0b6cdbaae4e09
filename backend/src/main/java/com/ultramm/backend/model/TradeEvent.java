package com.ultramm.backend.model;

import java.time.Instant;

public record TradeEvent(
        String symbol,
        double price,
        double size,
        Instant timestamp
) implements MarketEvent {}
