package com.ultramm.backend.event;

import com.ultramm.backend.dto.PerformanceMetrics;

public record PerformanceMetricsEvent(PerformanceMetrics metrics) {}
