package com.flightsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureScaler}.
 */
class FeatureScalerTest {

    @Test
    @DisplayName("Should centre on the mean and divide by the population standard deviation")
    void shouldStandardize() {
        FeatureScaler scaler = FeatureScaler.fit(List.of(
                new double[] { 1, 10 },
                new double[] { 3, 10 },
                new double[] { 5, 10 }));

        assertThat(scaler.getMean()).containsExactly(3, 10);
        // population stddev of {1,3,5} is sqrt(8/3)
        assertThat(scaler.getScale()[0]).isCloseTo(Math.sqrt(8.0 / 3.0), within(1e-12));

        double[] scaled = scaler.transform(new double[] { 5, 12 });
        assertThat(scaled[0]).isCloseTo(2 / Math.sqrt(8.0 / 3.0), within(1e-12));
        assertThat(scaled[1]).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("A constant feature should use scale 1")
    void shouldUseUnitScaleForConstantFeature() {
        FeatureScaler scaler = FeatureScaler.fit(List.of(new double[] { 7 }, new double[] { 7 }));

        assertThat(scaler.getScale()).containsExactly(1.0);
        assertThat(scaler.transform(new double[] { 7 })).containsExactly(0.0);
    }

    @Test
    @DisplayName("Should reject empty samples and mismatched dimensions")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> FeatureScaler.fit(List.of()))
                .isInstanceOf(IllegalArgumentException.class);

        FeatureScaler scaler = FeatureScaler.fit(List.<double[]>of(new double[] { 1, 2 }));
        assertThatThrownBy(() -> scaler.transform(new double[] { 1 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("length 2");
    }
}
