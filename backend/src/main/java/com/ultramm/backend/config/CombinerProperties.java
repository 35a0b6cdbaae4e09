package com.ultramm.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "combiner")
@Data
@Validated
public class CombinerProperties {

    // Ticks between weight rebalances
    @Min(1)
    private int rebalanceInterval = 60;

    // Ticks for a strategy's performance history to lose half its weight
    @Positive
    private double performanceHalfLife = 100.0;

    // Added to every score before normalizing so no strategy is starved to zero
    @PositiveOrZero
    private double weightFloor = 0.05;

    // Minimum number of scored ticks before a strategy's score counts
    @Min(1)
    private int minObservations = 10;
}
