package com.ultramm.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "data")
@Data
@Validated
public class DataProperties {

    // Snapshots older than this are rejected as stale
    @NotNull
    private Duration cacheExpiry = Duration.ofSeconds(60);

    // Cadence of the per-symbol evaluation loop
    @NotNull
    private Duration tickInterval = Duration.ofSeconds(1);

    @Min(1)
    private int orderBookDepth = 10;

    @NotNull
    private Duration candleInterval = Duration.ofMinutes(1);

    // Closed candles retained per symbol
    @Min(3)
    private int windowSize = 100;

    @Min(1)
    private int shortMaPeriod = 5;

    @Min(2)
    private int longMaPeriod = 20;

    @Min(1)
    private int meanReversionPeriod = 10;

    // Decay of the spread, depth and volatility baselines
    @Positive
    @DecimalMax("1.0")
    private double baselineAlpha = 0.05;
}
