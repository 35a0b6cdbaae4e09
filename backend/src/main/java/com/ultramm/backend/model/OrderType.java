package com.ultramm.backend.model;

public enum OrderType {
    LIMIT,
    MARKET
}
