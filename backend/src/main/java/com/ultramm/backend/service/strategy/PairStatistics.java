package com.ultramm.backend.service.strategy;

import com.ultramm.backend.model.MarketSnapshot;
import com.ultramm.backend.util.Ewma;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Exponentially weighted hedge ratio and spread statistics for one pair.
 * The hedge ratio regresses the second leg's log returns on the first's; the spread is
 * {@code ln(second) - beta * ln(first)}. The z-score of each observation is taken against the
 * statistics accumulated before it. Not thread-safe; callers synchronize on the instance.
 */
class PairStatistics {

    private final double alpha;
    private final int warmUpTicks;
    private final int persistenceWindow;
    private final double entryThreshold;
    private final Ewma spread;
    private final Deque<Boolean> exceedances = new ArrayDeque<>();

    private Instant lastFirstTimestamp;
    private Instant lastSecondTimestamp;
    private double previousLogFirst = Double.NaN;
    private double previousLogSecond = Double.NaN;
    private double meanReturnFirst;
    private double meanReturnSecond;
    private double covariance;
    private double varianceFirst;
    private long returnCount;
    private double hedgeRatio = 1.0;
    private double zScore = Double.NaN;
    private long observations;

    PairStatistics(double halfLifeTicks, int warmUpTicks, int persistenceWindow, double entryThreshold) {
        this.alpha = Ewma.alphaForHalfLife(halfLifeTicks);
        this.warmUpTicks = warmUpTicks;
        this.persistenceWindow = persistenceWindow;
        this.entryThreshold = entryThreshold;
        this.spread = new Ewma(alpha);
    }

    /**
     * Folds in a new pair of snapshots. Returns false, leaving every statistic untouched, when
     * neither snapshot is newer than the last one observed.
     */
    boolean observe(MarketSnapshot first, MarketSnapshot second) {
        if (first.timestamp().equals(lastFirstTimestamp) && second.timestamp().equals(lastSecondTimestamp)) {
            return false;
        }
        double priceFirst = first.midPrice();
        double priceSecond = second.midPrice();
        if (priceFirst <= 0 || priceSecond <= 0) {
            return false;
        }
        lastFirstTimestamp = first.timestamp();
        lastSecondTimestamp = second.timestamp();

        double logFirst = Math.log(priceFirst);
        double logSecond = Math.log(priceSecond);
        if (!Double.isNaN(previousLogFirst)) {
            updateHedgeRatio(logFirst - previousLogFirst, logSecond - previousLogSecond);
        }
        previousLogFirst = logFirst;
        previousLogSecond = logSecond;

        double value = logSecond - hedgeRatio * logFirst;
        if (observations >= warmUpTicks && spread.variance() > 1e-18) {
            zScore = (value - spread.mean()) / spread.stdDev();
        } else {
            zScore = Double.NaN;
        }
        spread.update(value);
        observations++;

        exceedances.addLast(!Double.isNaN(zScore) && Math.abs(zScore) > entryThreshold);
        while (exceedances.size() > persistenceWindow) {
            exceedances.removeFirst();
        }
        return true;
    }

    private void updateHedgeRatio(double returnFirst, double returnSecond) {
        double weight = Math.max(alpha, 1.0 / (returnCount + 1));
        double deltaFirst = returnFirst - meanReturnFirst;
        double deltaSecond = returnSecond - meanReturnSecond;
        meanReturnFirst += weight * deltaFirst;
        meanReturnSecond += weight * deltaSecond;
        covariance = (1.0 - weight) * (covariance + weight * deltaFirst * deltaSecond);
        varianceFirst = (1.0 - weight) * (varianceFirst + weight * deltaFirst * deltaFirst);
        returnCount++;
        if (varianceFirst > 1e-18) {
            hedgeRatio = covariance / varianceFirst;
        }
    }

    /**
     * NaN until the warm-up period has passed.
     */
    double zScore() {
        return zScore;
    }

    double hedgeRatio() {
        return hedgeRatio;
    }

    long observations() {
        return observations;
    }

    /**
     * Ticks within the persistence window whose z-score exceeded the entry threshold, at least one.
     */
    int persistence() {
        int count = 0;
        for (Boolean exceeded : exceedances) {
            if (exceeded) {
                count++;
            }
        }
        return Math.max(1, count);
    }
}
