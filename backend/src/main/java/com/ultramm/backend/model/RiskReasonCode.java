package com.ultramm.backend.model;

public enum RiskReasonCode {
    OK("ok"),
    NO_SIGNAL("no signal"),
    DRAWDOWN_BREACH("drawdown breach"),
    GLOBAL_SUSPENDED("trading suspended"),
    SYMBOL_SUSPENDED("symbol suspended"),
    VOLATILITY_ANOMALY("volatility anomaly"),
    VOLUME_SPIKE("volume spike"),
    SPREAD_ANOMALY("spread anomaly"),
    STOP_LOSS("stop loss"),
    TAKE_PROFIT("take profit"),
    POSITION_LIMIT("position limit"),
    OPEN_ORDER_LIMIT("open order limit");

    private final String description;

    RiskReasonCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
