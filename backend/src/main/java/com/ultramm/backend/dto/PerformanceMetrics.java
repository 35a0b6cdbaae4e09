package com.ultramm.backend.dto;

import java.time.Instant;

public record PerformanceMetrics(
        double equity,
        double totalPnl,
        double realizedPnl,
        double unrealizedPnl,
        double sharpeRatio,
        double drawdownPercent,
        double maxDrawdownPercent,
        double winRate,
        double volume,
        long trades,
        Instant at
) {}
