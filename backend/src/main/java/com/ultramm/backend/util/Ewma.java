package com.ultramm.backend.util;

/**
 * Exponentially weighted mean and variance.
 * Until {@code 1 / alpha} samples have been seen the weight falls back to {@code 1 / n},
 * so early estimates equal the plain sample mean and population variance.
 * Not thread-safe.
 */
public class Ewma {

    private final double alpha;
    private double mean;
    private double variance;
    private long count;

    public Ewma(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("alpha must be in (0, 1]: " + alpha);
        }
        this.alpha = alpha;
    }

    public static Ewma withHalfLife(double halfLife) {
        return new Ewma(alphaForHalfLife(halfLife));
    }

    /**
     * Decay factor whose weight halves every {@code halfLife} observations.
     */
    public static double alphaForHalfLife(double halfLife) {
        if (halfLife <= 0) {
            throw new IllegalArgumentException("halfLife must be positive: " + halfLife);
        }
        return 1.0 - Math.pow(2.0, -1.0 / halfLife);
    }

    public double update(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return mean;
        }
        double weight = Math.max(alpha, 1.0 / (count + 1));
        double delta = value - mean;
        mean += weight * delta;
        variance = (1.0 - weight) * (variance + weight * delta * delta);
        count++;
        return mean;
    }

    public double mean() {
        return mean;
    }

    public double variance() {
        return variance;
    }

    public double stdDev() {
        return Math.sqrt(Math.max(variance, 0.0));
    }

    public long count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
