package com.ultramm.backend.service.risk;

import com.ultramm.backend.model.Side;

/**
 * Read-only view of working orders, used to count pending exposure against risk limits.
 */
public interface OpenOrderView {

    int openOrderCount(String symbol);

    /**
     * Unfilled quantity of the working orders on {@code side}.
     */
    double pendingExposure(String symbol, Side side);
}
