package com.ultramm.backend.dto;

import java.time.Instant;
import java.util.Set;

public record EngineStatus(
        boolean running,
        Set<String> activeSymbols,
        Set<String> stoppedSymbols,
        int pairTasks,
        Set<String> haltedExchanges,
        boolean globallySuspended,
        String globalSuspensionReason,
        Set<String> suspendedSymbols,
        Instant at
) {}
