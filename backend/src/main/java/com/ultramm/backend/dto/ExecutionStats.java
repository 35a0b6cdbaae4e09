package com.ultramm.backend.dto;

public record ExecutionStats(
        long ordersPlaced,
        long ordersFilled,
        long ordersCanceled,
        long ordersRejected,
        long ordersExpired,
        double totalVolume,
        double averageLatencyMs
) {}
