package com.ultramm.backend.trading.pipeline;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per symbol. Risk gating and order submission for a symbol hold it, so a decision is
 * never gated against a position that another decision is about to change.
 */
@Component
public class SymbolLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(symbol, key -> new ReentrantLock());
    }
}
