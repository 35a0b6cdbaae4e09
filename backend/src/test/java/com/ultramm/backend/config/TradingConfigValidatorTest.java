package com.ultramm.backend.config;

import com.ultramm.backend.exception.ConfigValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradingConfigValidatorTest {

    private final DataProperties data = new DataProperties();
    private final RiskProperties risk = new RiskProperties();
    private final ExecutionProperties execution = new ExecutionProperties();
    private final MarketsProperties markets = new MarketsProperties();
    private final TradingConfigValidator validator = new TradingConfigValidator(data, risk, execution, markets);

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate()).isEmpty();
    }

    @Test
    void crossFieldProblemsAreCollected() {
        data.setShortMaPeriod(30);
        risk.setMaxPositionBySymbol(Map.of("BTC/USDT", -1.0));
        execution.setMaxOrderAge(Duration.ofSeconds(1));
        markets.setSymbols(List.of("BTC/USDT", "BTC/USDT"));

        assertThat(validator.validate()).containsExactlyInAnyOrder(
                "data.short-ma-period must be below data.long-ma-period",
                "risk.max-position-by-symbol.BTC/USDT must be positive",
                "execution.max-order-age must exceed execution.call-timeout",
                "markets.symbols contains duplicates");
    }

    @Test
    void startupFailsOnInvalidConfiguration() {
        data.setTickInterval(Duration.ZERO);

        assertThatThrownBy(validator::validateOnStartup)
                .isInstanceOfSatisfying(ConfigValidationException.class,
                        e -> assertThat(e.getProblems()).containsExactly("data.tick-interval must be positive"));
    }

    @Test
    void stopLossAboveTakeProfitOnlyWarns() {
        risk.setStopLossPercent(10.0);

        assertThat(validator.validate()).isEmpty();
    }
}
