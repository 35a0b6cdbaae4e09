package com.ultramm.backend.config;

import com.ultramm.backend.model.OrderType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotNull
    private OrderType orderType = OrderType.LIMIT;

    // Max distance between a resubmitted price and the original, percent
    @PositiveOrZero
    private double maxSlippagePercent = 0.1;

    // Retries after the first attempt
    @Min(0)
    private int retryAttempts = 3;

    @NotNull
    private Duration retryDelay = Duration.ofSeconds(1);

    // Upper bound on a single exchange call
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(5);

    private boolean useIcebergOrders = false;

    // Legs larger than this are sliced when icebergs are enabled
    @Positive
    private double icebergThreshold = 0.1;

    @Positive
    @DecimalMax("1.0")
    private double icebergVisibleFraction = 0.2;

    @NotNull
    private Duration maxOrderAge = Duration.ofSeconds(300);

    // A live quote within this distance of the new price is kept, percent
    @PositiveOrZero
    private double quoteRefreshThresholdPercent = 0.1;

    @PositiveOrZero
    private double feeRate = 0.001;

    @NotNull
    private Duration stopTimeout = Duration.ofSeconds(10);

    // Terminal orders older than this are dropped from memory
    @NotNull
    private Duration historyRetention = Duration.ofHours(1);
}
