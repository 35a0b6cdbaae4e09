package com.ultramm.backend.util;

public final class MathUtils {

    private MathUtils() {
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * {@code value / baseline}, or {@code fallback} when the baseline is not usable.
     */
    public static double ratio(double value, double baseline, double fallback) {
        if (baseline <= 0 || Double.isNaN(baseline) || Double.isNaN(value)) {
            return fallback;
        }
        return value / baseline;
    }

    public static boolean isPositive(double value) {
        return value > 0 && !Double.isInfinite(value);
    }
}
