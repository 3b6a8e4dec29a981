package com.pharma.signal.engine.forecast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NormalDistributionTest {

    @Test
    void inverseCdf_knownQuantiles() {
        assertThat(NormalDistribution.inverseCdf(0.5)).isCloseTo(0.0, within(1e-9));
        assertThat(NormalDistribution.inverseCdf(0.975)).isCloseTo(1.959964, within(1e-6));
        assertThat(NormalDistribution.inverseCdf(0.995)).isCloseTo(2.575829, within(1e-6));
        assertThat(NormalDistribution.inverseCdf(0.01)).isCloseTo(-2.326348, within(1e-6));
    }

    @Test
    void inverseCdf_isAntisymmetric() {
        assertThat(NormalDistribution.inverseCdf(0.2))
                .isCloseTo(-NormalDistribution.inverseCdf(0.8), within(1e-9));
    }

    @Test
    void twoSidedCriticalValue_ninetyFivePercent() {
        assertThat(NormalDistribution.twoSidedCriticalValue(0.95)).isCloseTo(1.96, within(1e-3));
        assertThat(NormalDistribution.twoSidedCriticalValue(0.80)).isCloseTo(1.2816, within(1e-3));
    }

    @Test
    void inverseCdf_outOfRange_throws() {
        assertThatThrownBy(() -> NormalDistribution.inverseCdf(1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NormalDistribution.inverseCdf(0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
