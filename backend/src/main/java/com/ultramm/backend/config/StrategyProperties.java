package com.ultramm.backend.config;

import com.ultramm.backend.service.strategy.StrategyKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy instances to run. Each definition names its type and carries the parameter block
 * for that type; blocks for other types are ignored.
 */
@Configuration
@ConfigurationProperties(prefix = "strategies")
@Data
@Validated
public class StrategyProperties {

    @Valid
    private List<Definition> enabled = new ArrayList<>();

    @Data
    public static class Definition {
        @NotBlank
        private String id;

        @NotNull
        private StrategyKind type;

        private List<String> symbols = new ArrayList<>();

        private List<List<String>> symbolPairs = new ArrayList<>();

        @Valid
        private MarketMaking marketMaking = new MarketMaking();

        @Valid
        private Adaptive adaptive = new Adaptive();

        @Valid
        private StatisticalArbitrage statisticalArbitrage = new StatisticalArbitrage();
    }

    @Data
    public static class MarketMaking {
        // Percent of mid
        @Positive
        private double spreadBid = 0.1;

        @Positive
        private double spreadAsk = 0.1;

        // Minimum total quoted spread, percent of mid
        @PositiveOrZero
        private double minProfit = 0.05;

        @Positive
        private double orderSize = 0.01;

        @Min(1)
        private int orderCount = 1;

        @NotNull
        private Duration refreshRate = Duration.ofSeconds(10);

        @Positive
        private double maxPosition = 1.0;
    }

    @Data
    public static class Adaptive {
        @PositiveOrZero
        private double volatilityFactor = 1.0;

        @PositiveOrZero
        private double volumeFactor = 0.8;

        @PositiveOrZero
        private double trendFactor = 0.5;

        @PositiveOrZero
        private double liquidityFactor = 1.0;

        @PositiveOrZero
        private double meanReversionFactor = 0.5;

        @PositiveOrZero
        private double aiWeight = 0.0;

        @Positive
        private double minSpreadMultiplier = 0.5;

        @Positive
        private double maxSpreadMultiplier = 3.0;

        @Positive
        private double minSizeMultiplier = 0.5;

        @Positive
        private double maxSizeMultiplier = 2.0;

        // Absolute bounds on each side's spread, percent of mid
        @Positive
        private double minSpreadPercent = 0.01;

        @Positive
        private double maxSpreadPercent = 2.0;
    }

    @Data
    public static class StatisticalArbitrage {
        @Positive
        private double entryThreshold = 2.0;

        @PositiveOrZero
        private double exitThreshold = 0.5;

        @NotNull
        private Duration halfLife = Duration.ofHours(24);

        @Min(2)
        private int warmUpTicks = 30;

        @Min(1)
        private int persistenceWindow = 10;

        @Positive
        private double positionSize = 0.01;

        @Positive
        private double maxPosition = 1.0;
    }
}
