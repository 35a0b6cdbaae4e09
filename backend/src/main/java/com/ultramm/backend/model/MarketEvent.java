package com.ultramm.backend.model;

import java.time.Instant;

/**
 * Raw update pushed by an exchange stream, either a {@link TradeEvent} or a {@link DepthEvent}.
 */
public interface MarketEvent {

    String symbol();

    Instant timestamp();
}
