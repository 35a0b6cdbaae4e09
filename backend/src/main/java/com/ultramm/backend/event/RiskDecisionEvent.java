package com.ultramm.backend.event;

import com.ultramm.backend.model.RiskDecision;

public record RiskDecisionEvent(RiskDecision decision) {}
