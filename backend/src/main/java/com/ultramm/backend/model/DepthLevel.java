package com.ultramm.backend.model;

public record DepthLevel(
        double price,
        double quantity
) {}
