package com.flightsentinel.core.detection;

import com.flightsentinel.core.TelemetryFixtures;
import com.flightsentinel.core.config.ModelSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ForestOutlierModel}.
 */
class ForestOutlierModelTest {

    private static final double[] CENTRE = {
            TelemetryFixtures.ALTITUDE, TelemetryFixtures.AIRSPEED, TelemetryFixtures.PITCH, 2.0 };
    private static final double[] HIGH_VIBRATION = {
            TelemetryFixtures.ALTITUDE, TelemetryFixtures.AIRSPEED, TelemetryFixtures.PITCH, 9.0 };

    private ForestOutlierModel model;

    @BeforeEach
    void setUp() {
        model = new ForestOutlierModel(new ModelSettings());
    }

    @Test
    @DisplayName("Scoring before any fit reports NOT_TRAINED instead of an empty result")
    void shouldReportNotTrainedBeforeFit() {
        ScoreResult result = model.score(List.of(CENTRE));

        assertThat(model.isTrained()).isFalse();
        assertThat(result.getStatus()).isEqualTo(ScoreResult.Status.NOT_TRAINED);
        assertThatThrownBy(result::getLabels).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Fit with 119 vectors is refused; fit with exactly 120 succeeds")
    void shouldEnforceMinimumTrainingSize() {
        List<double[]> sample = normalVectors(120, 1L);

        assertThat(model.fit(sample.subList(0, 119))).isEqualTo(FitResult.INSUFFICIENT_DATA);
        assertThat(model.isTrained()).isFalse();
        assertThat(model.score(List.of(CENTRE)).isOk()).isFalse();

        assertThat(model.fit(sample)).isEqualTo(FitResult.TRAINED);
        assertThat(model.isTrained()).isTrue();
    }

    @Test
    @DisplayName("A refused fit leaves the previous model state untouched")
    void shouldKeepStateOnRefusedFit() {
        model.fit(normalVectors(120, 2L));
        double threshold = model.getThreshold();
        List<Label> before = model.score(List.of(CENTRE, HIGH_VIBRATION)).getLabels();

        assertThat(model.fit(normalVectors(30, 3L))).isEqualTo(FitResult.INSUFFICIENT_DATA);

        assertThat(model.getThreshold()).isEqualTo(threshold);
        assertThat(model.score(List.of(CENTRE, HIGH_VIBRATION)).getLabels()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should label normal flight as inlier and extreme vibration as outlier")
    void shouldSeparateNormalFromExtreme() {
        model.fit(normalVectors(120, 4L));

        List<Label> labels = model.score(List.of(CENTRE, HIGH_VIBRATION)).getLabels();

        assertThat(labels).containsExactly(Label.INLIER, Label.OUTLIER);
    }

    @Test
    @DisplayName("Unseen normal flight is flagged at roughly the contamination rate")
    void shouldHonourContaminationOnUnseenData() {
        model.fit(normalVectors(200, 11L));

        long outliers = model.score(normalVectors(5_000, 99L)).getLabels().stream()
                .filter(l -> l == Label.OUTLIER)
                .count();

        // 5% of 5000 = 250
        assertThat(outliers).isBetween(75L, 400L);
    }

    @Test
    @DisplayName("Points the forest was grown on rarely exceed the held-out threshold")
    void shouldNotOverFlagTrainingSample() {
        List<double[]> sample = normalVectors(200, 5L);
        model.fit(sample);

        long outliers = model.score(sample).getLabels().stream()
                .filter(l -> l == Label.OUTLIER)
                .count();

        assertThat(outliers).isLessThanOrEqualTo(15L);
    }

    @Test
    @DisplayName("Each fit replaces normalization and boundary instead of merging with the last one")
    void shouldReplaceStateOnRefit() {
        model.fit(normalVectors(120, 6L));
        assertThat(model.score(List.of(HIGH_VIBRATION)).getLabels()).containsExactly(Label.OUTLIER);

        List<double[]> shifted = new ArrayList<>();
        for (double[] v : normalVectors(120, 7L)) {
            shifted.add(new double[] { v[0], v[1], v[2], v[3] + 7.0 });
        }
        assertThat(model.fit(shifted)).isEqualTo(FitResult.TRAINED);

        assertThat(model.score(List.of(HIGH_VIBRATION)).getLabels()).containsExactly(Label.INLIER);
    }

    @Test
    @DisplayName("Same sample and seed should give the same boundary")
    void shouldBeReproducible() {
        List<double[]> sample = normalVectors(150, 8L);
        ForestOutlierModel other = new ForestOutlierModel(new ModelSettings());

        model.fit(sample);
        other.fit(sample);

        assertThat(other.getThreshold()).isEqualTo(model.getThreshold());
    }

    @Test
    @DisplayName("Quantile should interpolate linearly between order statistics")
    void shouldInterpolateQuantile() {
        double[] values = { 5, 1, 4, 2, 3 };

        assertThat(ForestOutlierModel.quantile(values, 0.5)).isEqualTo(3.0);
        assertThat(ForestOutlierModel.quantile(values, 1.0)).isEqualTo(5.0);
        assertThat(ForestOutlierModel.quantile(values, 0.9)).isCloseTo(4.6, within(1e-12));
    }

    @Test
    @DisplayName("Should reject invalid settings at construction")
    void shouldValidateSettings() {
        ModelSettings settings = new ModelSettings();
        settings.setContamination(0.0);

        assertThatThrownBy(() -> new ForestOutlierModel(settings))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<double[]> normalVectors(int count, long seed) {
        return FeatureExtractor.extractAll(TelemetryFixtures.normalFlight(count, seed));
    }
}
