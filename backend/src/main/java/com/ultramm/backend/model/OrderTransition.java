package com.ultramm.backend.model;

import java.time.Instant;

public record OrderTransition(
        OrderState from,
        OrderState to,
        Instant at,
        String reason
) {}
