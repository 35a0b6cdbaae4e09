package com.ultramm.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "monitoring")
@Data
@Validated
public class MonitoringProperties {

    @NotNull
    private Duration metricsInterval = Duration.ofSeconds(60);

    // Equity samples kept for the Sharpe estimate
    @Min(2)
    private int equityWindow = 1000;

    /**
     * Number of metric intervals in a year, used to annualize the Sharpe ratio.
     */
    public double periodsPerYear() {
        long millis = Math.max(1L, metricsInterval.toMillis());
        return Duration.ofDays(365).toMillis() / (double) millis;
    }
}
