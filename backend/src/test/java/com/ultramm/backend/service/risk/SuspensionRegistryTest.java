package com.ultramm.backend.service.risk;

import com.ultramm.backend.config.RiskProperties;
import com.ultramm.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SuspensionRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void symbolSuspensionLapsesAfterDuration() {
        SuspensionRegistry registry = new SuspensionRegistry(new RiskProperties(), clock);

        registry.suspend("BTC/USDT", Duration.ofMinutes(5), "spread anomaly");

        assertThat(registry.isSuspended("BTC/USDT")).isTrue();
        assertThat(registry.isSuspended("ETH/USDT")).isFalse();
        clock.advance(Duration.ofMinutes(5));
        assertThat(registry.isSuspended("BTC/USDT")).isFalse();
    }

    @Test
    void longerSuspensionWins() {
        SuspensionRegistry registry = new SuspensionRegistry(new RiskProperties(), clock);

        registry.suspend("BTC/USDT", Duration.ofMinutes(10), "volume spike");
        registry.suspend("BTC/USDT", Duration.ofMinutes(1), "spread anomaly");
        clock.advance(Duration.ofMinutes(2));

        assertThat(registry.isSuspended("BTC/USDT")).isTrue();
        assertThat(registry.status().symbols().get("BTC/USDT").reason()).isEqualTo("volume spike");
    }

    @Test
    void globalHaltNeedsResetUnlessAutoResetConfigured() {
        SuspensionRegistry manual = new SuspensionRegistry(new RiskProperties(), clock);
        assertThat(manual.suspendAll("drawdown")).isTrue();
        assertThat(manual.suspendAll("drawdown again")).isFalse();
        clock.advance(Duration.ofDays(1));
        assertThat(manual.isGloballySuspended()).isTrue();
        manual.resetGlobal();
        assertThat(manual.isGloballySuspended()).isFalse();
        assertThat(manual.globalResetCount()).isEqualTo(1);

        RiskProperties properties = new RiskProperties();
        properties.setDrawdownAutoReset(Duration.ofHours(1));
        SuspensionRegistry automatic = new SuspensionRegistry(properties, clock);
        automatic.suspendAll("drawdown");
        clock.advance(Duration.ofMinutes(59));
        assertThat(automatic.isGloballySuspended()).isTrue();
        clock.advance(Duration.ofMinutes(1));
        assertThat(automatic.isGloballySuspended()).isFalse();
        assertThat(automatic.globalResetCount()).isEqualTo(1);
    }
}
