package com.flightsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfigLoader}.
 */
class DetectorConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test config from classpath")
    void shouldLoadFromClasspath() {
        DetectorConfig config = DetectorConfigLoader.fromClasspath("test-detector.yml");

        assertThat(config.getTelemetryPath()).isEqualTo("data/telemetry.jsonl");
        assertThat(config.getAnomaliesPath()).isEqualTo("data/anomalies.json");
        assertThat(config.getPollIntervalMs()).isEqualTo(100);
        assertThat(config.getBackoffIntervalMs()).isEqualTo(250);
        assertThat(config.getRetrainThreshold()).isEqualTo(3);
        assertThat(config.getModel().getContamination()).isEqualTo(0.1);
        assertThat(config.getModel().getNumberOfTrees()).isEqualTo(30);
        assertThat(config.getModel().getSampleSize()).isEqualTo(64);
        assertThat(config.getModel().getRandomSeed()).isEqualTo(7L);
        assertThat(config.getModel().getMinTrainingSize()).isEqualTo(50);
    }

    @Test
    @DisplayName("Omitted keys should keep their defaults")
    void shouldApplyDefaults() throws Exception {
        Path file = tempDir.resolve("partial.yml");
        Files.writeString(file, "pollIntervalMs: 500\n");

        DetectorConfig config = DetectorConfigLoader.fromFile(file.toString());

        assertThat(config.getPollIntervalMs()).isEqualTo(500);
        assertThat(config.getBackoffIntervalMs()).isEqualTo(5_000);
        assertThat(config.getRetrainThreshold()).isEqualTo(10);
        assertThat(config.getTelemetryPath()).isEqualTo("telemetry.jsonl");
        assertThat(config.getModel().getContamination()).isEqualTo(0.05);
        assertThat(config.getModel().getNumberOfTrees()).isEqualTo(100);
        assertThat(config.getModel().getRandomSeed()).isEqualTo(42L);
        assertThat(config.getModel().getMinTrainingSize()).isEqualTo(120);
    }

    @Test
    @DisplayName("An empty file should yield the defaults")
    void shouldTreatEmptyFileAsDefaults() throws Exception {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        DetectorConfig config = DetectorConfigLoader.fromFile(file.toString());

        assertThat(config.getPollIntervalMs()).isEqualTo(2_000);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> DetectorConfigLoader.fromClasspath("invalid-detector.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("telemetryPath")
                .hasMessageContaining("pollIntervalMs")
                .hasMessageContaining("model.contamination")
                .hasMessageContaining("model.numberOfTrees");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectorConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        String missing = tempDir.resolve("nope.yml").toString();

        assertThatThrownBy(() -> DetectorConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() throws Exception {
        Path file = tempDir.resolve("dup.yml");
        Files.writeString(file, "pollIntervalMs: 1\npollIntervalMs: 2\n");

        assertThatThrownBy(() -> DetectorConfigLoader.fromFile(file.toString()))
                .isInstanceOf(RuntimeException.class);
    }
}
