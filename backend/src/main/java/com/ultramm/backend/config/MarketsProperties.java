package com.ultramm.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "markets")
@Data
@Validated
public class MarketsProperties {

    public enum Mode {
        SIMULATION,
        PAPER,
        LIVE
    }

    private Mode mode = Mode.SIMULATION;

    @NotBlank
    private String defaultExchange = "paper";

    @NotEmpty
    private List<String> symbols = new ArrayList<>(List.of("BTC/USDT", "ETH/USDT", "SOL/USDT"));

    // Symbol -> exchange id overrides
    private Map<String, String> symbolExchanges = new HashMap<>();

    @Valid
    private Simulation simulation = new Simulation();

    public String exchangeFor(String symbol) {
        return symbolExchanges.getOrDefault(symbol, defaultExchange);
    }

    @Data
    public static class Simulation {
        private Map<String, Double> initialPrices = new HashMap<>(Map.of(
                "BTC/USDT", 50000.0,
                "ETH/USDT", 3000.0,
                "SOL/USDT", 100.0
        ));

        // Per-tick standard deviation of the simulated mid, in percent
        @Positive
        private double volatilityPercent = 0.05;

        @Positive
        private double spreadPercent = 0.02;

        @Positive
        private double levelQuantity = 1.0;

        private Duration interval = Duration.ofMillis(500);

        private long seed = 42L;

        @Positive
        private double quoteBalance = 10000.0;
    }
}
