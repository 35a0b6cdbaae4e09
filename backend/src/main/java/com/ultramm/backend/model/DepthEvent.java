package com.ultramm.backend.model;

import java.time.Instant;
import java.util.List;

public record DepthEvent(
        String symbol,
        List<DepthLevel> bids,
        List<DepthLevel> asks,
        Instant timestamp
) implements MarketEvent {}
