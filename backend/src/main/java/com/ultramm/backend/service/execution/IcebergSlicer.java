package com.ultramm.backend.service.execution;

import java.util.ArrayList;
import java.util.List;

final class IcebergSlicer {

    private IcebergSlicer() {
    }

    /**
     * Splits {@code total} into visible slices of {@code total * visibleFraction}; the last slice
     * takes the remainder so the slices sum exactly to {@code total}.
     */
    static List<Double> slice(double total, double visibleFraction) {
        double chunk = total * visibleFraction;
        List<Double> slices = new ArrayList<>();
        double allocated = 0.0;
        while (total - allocated > chunk * (1.0 + 1e-9)) {
            slices.add(chunk);
            allocated += chunk;
        }
        slices.add(total - allocated);
        return slices;
    }
}
