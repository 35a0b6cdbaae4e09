package com.ultramm.backend.event;

import java.time.Instant;

public record ExchangeHaltedEvent(String exchangeId, String reason, Instant at) {}
