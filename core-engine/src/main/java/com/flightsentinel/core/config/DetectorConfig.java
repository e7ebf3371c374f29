package com.flightsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detector YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * telemetryPath: telemetry.jsonl
 * anomaliesPath: anomalies.json
 * pollIntervalMs: 2000
 * backoffIntervalMs: 5000
 * retrainThreshold: 10
 * model:
 *   contamination: 0.05
 *   numberOfTrees: 100
 *   sampleSize: 256
 *   randomSeed: 42
 *   minTrainingSize: 120
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig {

    /** Line-delimited JSON file appended to by the telemetry producer. */
    private String telemetryPath = "telemetry.jsonl";

    /** JSON array file holding confirmed anomalies. */
    private String anomaliesPath = "anomalies.json";

    /** Rest between two ingestion cycles. */
    private long pollIntervalMs = 2_000;

    /** Rest after a cycle that ended in an unexpected error. */
    private long backoffIntervalMs = 5_000;

    /** Number of false positives tolerated before a retrain is forced. */
    private int retrainThreshold = 10;

    private ModelSettings model = new ModelSettings();

    /**
     * Validate every value in this configuration. Collects all errors and
     * throws a single exception if anything is invalid.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (telemetryPath == null || telemetryPath.isBlank()) {
            errors.add("'telemetryPath' is required");
        }
        if (anomaliesPath == null || anomaliesPath.isBlank()) {
            errors.add("'anomaliesPath' is required");
        }
        if (pollIntervalMs < 0) {
            errors.add("'pollIntervalMs' must be >= 0, got: " + pollIntervalMs);
        }
        if (backoffIntervalMs < 0) {
            errors.add("'backoffIntervalMs' must be >= 0, got: " + backoffIntervalMs);
        }
        if (retrainThreshold < 0) {
            errors.add("'retrainThreshold' must be >= 0, got: " + retrainThreshold);
        }
        if (model == null) {
            errors.add("'model' block must not be null");
        } else {
            errors.addAll(model.errors());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detector configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getTelemetryPath() {
        return telemetryPath;
    }

    public void setTelemetryPath(String telemetryPath) {
        this.telemetryPath = telemetryPath;
    }

    public String getAnomaliesPath() {
        return anomaliesPath;
    }

    public void setAnomaliesPath(String anomaliesPath) {
        this.anomaliesPath = anomaliesPath;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getBackoffIntervalMs() {
        return backoffIntervalMs;
    }

    public void setBackoffIntervalMs(long backoffIntervalMs) {
        this.backoffIntervalMs = backoffIntervalMs;
    }

    public int getRetrainThreshold() {
        return retrainThreshold;
    }

    public void setRetrainThreshold(int retrainThreshold) {
        this.retrainThreshold = retrainThreshold;
    }

    public ModelSettings getModel() {
        return model;
    }

    public void setModel(ModelSettings model) {
        this.model = model;
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "telemetryPath='" + telemetryPath + '\'' +
                ", anomaliesPath='" + anomaliesPath + '\'' +
                ", pollIntervalMs=" + pollIntervalMs +
                ", backoffIntervalMs=" + backoffIntervalMs +
                ", retrainThreshold=" + retrainThreshold +
                ", model=" + model +
                '}';
    }
}
