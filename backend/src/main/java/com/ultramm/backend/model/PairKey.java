package com.ultramm.backend.model;

public record PairKey(
        String first,
        String second
) {

    public String id() {
        return first + "~" + second;
    }

    public boolean contains(String symbol) {
        return first.equals(symbol) || second.equals(symbol);
    }

    @Override
    public String toString() {
        return id();
    }
}
