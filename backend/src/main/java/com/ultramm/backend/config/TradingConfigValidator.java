package com.ultramm.backend.config;

import com.ultramm.backend.exception.ConfigValidationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-field checks bean validation cannot express. Any problem stops startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TradingConfigValidator {

    private final DataProperties dataProperties;
    private final RiskProperties riskProperties;
    private final ExecutionProperties executionProperties;
    private final MarketsProperties marketsProperties;

    @PostConstruct
    void validateOnStartup() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new ConfigValidationException(problems);
        }
        log.info("Trading configuration validated for {} symbols in {} mode",
                marketsProperties.getSymbols().size(), marketsProperties.getMode());
    }

    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (dataProperties.getShortMaPeriod() >= dataProperties.getLongMaPeriod()) {
            problems.add("data.short-ma-period must be below data.long-ma-period");
        }
        if (dataProperties.getLongMaPeriod() > dataProperties.getWindowSize()) {
            problems.add("data.long-ma-period must not exceed data.window-size");
        }
        if (dataProperties.getMeanReversionPeriod() > dataProperties.getWindowSize()) {
            problems.add("data.mean-reversion-period must not exceed data.window-size");
        }
        if (dataProperties.getTickInterval().isZero() || dataProperties.getTickInterval().isNegative()) {
            problems.add("data.tick-interval must be positive");
        }
        if (riskProperties.getStopLossPercent() >= riskProperties.getTakeProfitPercent()) {
            log.warn("risk.stop-loss-percent {} is not below risk.take-profit-percent {}",
                    riskProperties.getStopLossPercent(), riskProperties.getTakeProfitPercent());
        }
        for (Map.Entry<String, Double> limit : riskProperties.getMaxPositionBySymbol().entrySet()) {
            if (limit.getValue() == null || limit.getValue() <= 0) {
                problems.add("risk.max-position-by-symbol." + limit.getKey() + " must be positive");
            }
        }
        if (executionProperties.getIcebergVisibleFraction() <= 0 || executionProperties.getIcebergVisibleFraction() > 1) {
            problems.add("execution.iceberg-visible-fraction must be in (0, 1]");
        }
        if (executionProperties.getMaxOrderAge().compareTo(executionProperties.getCallTimeout()) <= 0) {
            problems.add("execution.max-order-age must exceed execution.call-timeout");
        }
        if (marketsProperties.getSymbols().stream().distinct().count() != marketsProperties.getSymbols().size()) {
            problems.add("markets.symbols contains duplicates");
        }
        return problems;
    }
}
