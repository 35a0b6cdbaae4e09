package com.ultramm.backend.service.marketdata;

/**
 * Fixed-capacity series keeping running sums so mean and variance are O(1) per update.
 */
class RingSeries {

    private final double[] values;
    private int head;
    private int size;
    private double sum;
    private double sumOfSquares;

    RingSeries(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.values = new double[capacity];
    }

    void push(double value) {
        if (size == values.length) {
            double evicted = values[head];
            sum -= evicted;
            sumOfSquares -= evicted * evicted;
        } else {
            size++;
        }
        values[head] = value;
        head = (head + 1) % values.length;
        sum += value;
        sumOfSquares += value * value;
    }

    int size() {
        return size;
    }

    boolean isFull() {
        return size == values.length;
    }

    double mean() {
        return size == 0 ? 0.0 : sum / size;
    }

    /**
     * Sample standard deviation, zero below two values.
     */
    double stdDev() {
        if (size < 2) {
            return 0.0;
        }
        double mean = mean();
        double variance = (sumOfSquares - size * mean * mean) / (size - 1);
        return Math.sqrt(Math.max(variance, 0.0));
    }

    double last() {
        if (size == 0) {
            return Double.NaN;
        }
        return values[(head - 1 + values.length) % values.length];
    }
}
