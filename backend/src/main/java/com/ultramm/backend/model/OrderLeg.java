package com.ultramm.backend.model;

public record OrderLeg(
        Side side,
        double price,
        double size
) {

    public OrderLeg withSize(double newSize) {
        return new OrderLeg(side, price, newSize);
    }
}
