package com.ultramm.backend.event;

import java.time.Instant;

public record TradingHaltedEvent(String reason, double drawdownPercent, Instant at) {}
