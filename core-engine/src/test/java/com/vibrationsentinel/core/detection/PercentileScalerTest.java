package com.vibrationsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PercentileScaler}.
 */
class PercentileScalerTest {

    @Test
    @DisplayName("Healthy median maps to 0, healthy 95th percentile maps to 1")
    void anchorsMapToUnitInterval() {
        double[] healthy = new double[100];
        for (int i = 0; i < healthy.length; i++) {
            healthy[i] = i + 1;
        }
        PercentileScaler scaler = PercentileScaler.fit(healthy);

        assertThat(scaler.getMedian()).isCloseTo(50.5, within(1e-9));
        assertThat(scaler.getP95()).isCloseTo(95.95, within(1e-9));
        assertThat(scaler.scale(scaler.getMedian())).isZero();
        assertThat(scaler.scale(scaler.getP95())).isEqualTo(1.0);
        assertThat(scaler.scale((scaler.getMedian() + scaler.getP95()) / 2)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Values outside the anchors are clamped")
    void valuesAreClamped() {
        PercentileScaler scaler = new PercentileScaler(1.0, 2.0);

        assertThat(scaler.scale(-5.0)).isZero();
        assertThat(scaler.scale(1e9)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Degenerate healthy data should not divide by zero")
    void degenerateAnchors() {
        PercentileScaler scaler = PercentileScaler.fit(new double[] {0.3, 0.3, 0.3});

        assertThat(scaler.scale(0.3)).isZero();
        assertThat(scaler.scale(0.31)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject inverted anchors")
    void shouldRejectInvertedAnchors() {
        assertThatThrownBy(() -> new PercentileScaler(2.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
