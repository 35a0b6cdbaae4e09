package com.ultramm.backend.service.risk;

import com.ultramm.backend.config.RiskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-symbol suspension timers plus the global halt raised on a drawdown breach.
 * Symbol suspensions lapse on their own; the global halt lapses only when an automatic reset
 * delay is configured, otherwise it needs {@link #resetGlobal()}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SuspensionRegistry {

    public record Suspension(Instant until, String reason) {}

    public record Status(boolean globallySuspended, String globalReason, Instant globalSince,
                         Map<String, Suspension> symbols) {}

    private final RiskProperties riskProperties;
    private final Clock clock;
    private final ConcurrentHashMap<String, Suspension> suspensions = new ConcurrentHashMap<>();

    private volatile boolean globallySuspended;
    private volatile String globalReason;
    private volatile Instant globalSince;
    private final AtomicLong globalResets = new AtomicLong();

    public void suspend(String symbol, Duration duration, String reason) {
        Instant until = clock.instant().plus(duration);
        suspensions.merge(symbol, new Suspension(until, reason),
                (current, next) -> next.until().isAfter(current.until()) ? next : current);
        log.warn("Symbol {} suspended until {}: {}", symbol, until, reason);
    }

    public boolean isSuspended(String symbol) {
        Suspension suspension = suspensions.get(symbol);
        if (suspension == null) {
            return false;
        }
        if (!clock.instant().isBefore(suspension.until())) {
            if (suspensions.remove(symbol, suspension)) {
                log.info("Suspension of {} lapsed", symbol);
            }
            return false;
        }
        return true;
    }

    /**
     * @return true when this call raised the halt, false when it was already in place
     */
    public synchronized boolean suspendAll(String reason) {
        if (globallySuspended) {
            return false;
        }
        globallySuspended = true;
        globalReason = reason;
        globalSince = clock.instant();
        log.error("All trading suspended: {}", reason);
        return true;
    }

    public synchronized boolean isGloballySuspended() {
        if (globallySuspended && isAutoResetDue()) {
            log.warn("Global suspension automatically reset after {}", riskProperties.getDrawdownAutoReset());
            clearGlobal();
        }
        return globallySuspended;
    }

    public synchronized void resetGlobal() {
        if (globallySuspended) {
            log.warn("Global suspension reset manually (was: {})", globalReason);
        }
        clearGlobal();
    }

    public void reset(String symbol) {
        if (suspensions.remove(symbol) != null) {
            log.warn("Suspension of {} reset manually", symbol);
        }
    }

    public synchronized Status status() {
        Map<String, Suspension> active = new LinkedHashMap<>();
        for (String symbol : suspensions.keySet()) {
            if (isSuspended(symbol)) {
                Suspension suspension = suspensions.get(symbol);
                if (suspension != null) {
                    active.put(symbol, suspension);
                }
            }
        }
        return new Status(isGloballySuspended(), globalReason, globalSince, active);
    }

    private boolean isAutoResetDue() {
        Duration autoReset = riskProperties.getDrawdownAutoReset();
        return autoReset != null && !autoReset.isZero() && globalSince != null
                && !clock.instant().isBefore(globalSince.plus(autoReset));
    }

    /**
     * Number of times a global halt has been lifted, manually or automatically.
     */
    public long globalResetCount() {
        return globalResets.get();
    }

    private void clearGlobal() {
        if (globallySuspended) {
            globalResets.incrementAndGet();
        }
        globallySuspended = false;
        globalReason = null;
        globalSince = null;
    }
}
