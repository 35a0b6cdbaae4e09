package com.ultramm.backend.model;

public enum RiskOutcome {
    APPROVED,
    RESIZED,
    FORCED_EXIT,
    REJECTED
}
