package com.ultramm.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EwmaTest {

    @Test
    void halfLifeAlphaHalvesWeightAfterHalfLife() {
        double alpha = Ewma.alphaForHalfLife(10);
        assertThat(Math.pow(1 - alpha, 10)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void earlyObservationsAreEquallyWeighted() {
        Ewma ewma = new Ewma(0.01);
        ewma.update(1.0);
        ewma.update(3.0);
        assertThat(ewma.mean()).isCloseTo(2.0, within(1e-12));
        assertThat(ewma.count()).isEqualTo(2);
    }

    @Test
    void constantSeriesHasNoVariance() {
        Ewma ewma = Ewma.withHalfLife(5);
        for (int i = 0; i < 20; i++) {
            ewma.update(7.0);
        }
        assertThat(ewma.mean()).isCloseTo(7.0, within(1e-12));
        assertThat(ewma.stdDev()).isCloseTo(0.0, within(1e-9));
    }
}
