package com.ultramm.backend.service.marketdata;

import com.ultramm.backend.config.DataProperties;
import com.ultramm.backend.util.Ewma;
import com.ultramm.backend.util.MathUtils;

import java.time.Instant;

/**
 * Aggregates trades into fixed-interval candles and maintains the rolling indicator inputs over
 * the closed candles. Memory is bounded by the window size regardless of trade volume.
 */
class CandleWindow {

    private final long intervalMillis;
    private final RingSeries returns;
    private final RingSeries volumes;
    private final RingSeries shortCloses;
    private final RingSeries longCloses;
    private final RingSeries meanReversionCloses;
    private final Ewma volatilityBaseline;

    private long currentBucket = -1;
    private double currentClose;
    private double currentVolume;
    private double lastClosedPrice = Double.NaN;
    private double volatility;
    private double volatilityRatio = 1.0;
    private int closedCandles;

    CandleWindow(DataProperties properties) {
        this.intervalMillis = Math.max(1L, properties.getCandleInterval().toMillis());
        this.returns = new RingSeries(properties.getWindowSize());
        this.volumes = new RingSeries(properties.getWindowSize());
        this.shortCloses = new RingSeries(properties.getShortMaPeriod());
        this.longCloses = new RingSeries(properties.getLongMaPeriod());
        this.meanReversionCloses = new RingSeries(properties.getMeanReversionPeriod());
        this.volatilityBaseline = new Ewma(properties.getBaselineAlpha());
    }

    void onTrade(double price, double size, Instant timestamp) {
        long bucket = timestamp.toEpochMilli() / intervalMillis;
        if (currentBucket < 0) {
            openCandle(bucket, price);
        } else if (bucket > currentBucket) {
            closeCandle();
            openCandle(bucket, price);
        } else if (bucket < currentBucket) {
            // late trade, count its volume but keep the current close
            currentVolume += size;
            return;
        }
        currentClose = price;
        currentVolume += size;
    }

    private void openCandle(long bucket, double price) {
        currentBucket = bucket;
        currentClose = price;
        currentVolume = 0.0;
    }

    private void closeCandle() {
        double close = currentClose;
        if (lastClosedPrice > 0) {
            returns.push((close - lastClosedPrice) / lastClosedPrice * 100.0);
        }
        volumes.push(currentVolume);
        shortCloses.push(close);
        longCloses.push(close);
        meanReversionCloses.push(close);
        lastClosedPrice = close;
        closedCandles++;

        if (returns.size() >= 2) {
            volatility = returns.stdDev();
            volatilityRatio = volatilityBaseline.isEmpty()
                    ? 1.0
                    : MathUtils.ratio(volatility, volatilityBaseline.mean(), 1.0);
            volatilityBaseline.update(volatility);
        }
    }

    double volatility() {
        return volatility;
    }

    double volatilityRatio() {
        return volatilityRatio;
    }

    double volumeRatio() {
        if (volumes.size() == 0) {
            return 1.0;
        }
        return MathUtils.ratio(currentVolume, volumes.mean(), 1.0);
    }

    double trend() {
        if (!longCloses.isFull()) {
            return 0.0;
        }
        return shortCloses.mean() - longCloses.mean();
    }

    double meanReversion(double price) {
        if (meanReversionCloses.size() == 0 || price <= 0) {
            return 0.0;
        }
        double average = meanReversionCloses.mean();
        return MathUtils.clamp(-(price - average) / average, -1.0, 1.0);
    }

    int closedCandles() {
        return closedCandles;
    }
}
