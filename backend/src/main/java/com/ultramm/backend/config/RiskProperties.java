package com.ultramm.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    // Absolute net position per symbol, in base units
    @Positive
    private double maxPositionSize = 1000.0;

    private Map<String, Double> maxPositionBySymbol = new HashMap<>();

    @Positive
    private double maxDrawdownPercent = 5.0;

    @Positive
    private double stopLossPercent = 2.0;

    @Positive
    private double takeProfitPercent = 5.0;

    @Min(1)
    private int maxOpenOrders = 10;

    @Positive
    private double initialCapital = 10000.0;

    // Zero keeps a drawdown halt in place until reset manually
    @NotNull
    private Duration drawdownAutoReset = Duration.ZERO;

    private Manipulation manipulation = new Manipulation();

    public double maxPositionFor(String symbol) {
        return maxPositionBySymbol.getOrDefault(symbol, maxPositionSize);
    }

    @Data
    public static class Manipulation {
        private boolean enabled = true;

        @Positive
        private double volatilityThreshold = 3.0;

        @Positive
        private double volumeSpikeThreshold = 5.0;

        @Positive
        private double spreadAnomalyThreshold = 3.0;

        @NotNull
        private Duration cooldown = Duration.ofMinutes(5);
    }
}
