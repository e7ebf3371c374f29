package com.flightsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * A confirmed anomaly: a telemetry sample the model scored as an outlier and
 * whose ground truth did not contradict the call.
 *
 * <p>
 * Serialized as one element of the JSON array kept by
 * {@link com.flightsentinel.core.store.AnomalyStore}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromRecord(TelemetryRecord, Instant, Severity)} or the
 * {@link Builder}. The builder enforces that {@code detectedAt} and
 * {@code severity} are present; omitting either will throw a
 * {@link NullPointerException} at build time. The setters exist for Jackson
 * only; instances are not modified once built.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "altitude", "airspeed", "pitch", "vibration",
        "engineFailure", "detected_at", "severity" })
public class Anomaly {

    /** Producer timestamp, copied verbatim from the source record. */
    private Object timestamp;

    private double altitude;
    private double airspeed;
    private double pitch;
    private double vibration;

    /** Ground-truth label; {@code null} when the producer did not supply one. */
    private Boolean engineFailure;

    /** Wall-clock instant at which the detector confirmed the anomaly. */
    private Instant detectedAt;

    private Severity severity;

    /** No-arg constructor required by Jackson. */
    public Anomaly() {
    }

    private Anomaly(Builder builder) {
        this.timestamp = builder.timestamp;
        this.altitude = builder.altitude;
        this.airspeed = builder.airspeed;
        this.pitch = builder.pitch;
        this.vibration = builder.vibration;
        this.engineFailure = builder.engineFailure;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
    }

    /**
     * Build an anomaly from the telemetry record that produced it.
     *
     * @param record     source record; its four feature fields must be present
     * @param detectedAt detection instant
     * @param severity   severity tier of the record
     * @return new anomaly
     */
    public static Anomaly fromRecord(TelemetryRecord record, Instant detectedAt, Severity severity) {
        Objects.requireNonNull(record, "record must not be null");
        return builder()
                .timestamp(record.getTimestamp())
                .altitude(record.getNumericField(TelemetryRecord.ALTITUDE).orElse(Double.NaN))
                .airspeed(record.getNumericField(TelemetryRecord.AIRSPEED).orElse(Double.NaN))
                .pitch(record.getNumericField(TelemetryRecord.PITCH).orElse(Double.NaN))
                .vibration(record.getNumericField(TelemetryRecord.VIBRATION).orElse(Double.NaN))
                .engineFailure(record.getEngineFailure().orElse(null))
                .detectedAt(detectedAt)
                .severity(severity)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private Object timestamp;
        private double altitude;
        private double airspeed;
        private double pitch;
        private double vibration;
        private Boolean engineFailure;
        private Instant detectedAt;
        private Severity severity;

        public Builder timestamp(Object timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder altitude(double altitude) {
            this.altitude = altitude;
            return this;
        }

        public Builder airspeed(double airspeed) {
            this.airspeed = airspeed;
            return this;
        }

        public Builder pitch(double pitch) {
            this.pitch = pitch;
            return this;
        }

        public Builder vibration(double vibration) {
            this.vibration = vibration;
            return this;
        }

        public Builder engineFailure(Boolean engineFailure) {
            this.engineFailure = engineFailure;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if {@code detectedAt} or {@code severity}
         *                              is {@code null}
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public Object getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Object timestamp) {
        this.timestamp = timestamp;
    }

    public double getAltitude() {
        return altitude;
    }

    public void setAltitude(double altitude) {
        this.altitude = altitude;
    }

    public double getAirspeed() {
        return airspeed;
    }

    public void setAirspeed(double airspeed) {
        this.airspeed = airspeed;
    }

    public double getPitch() {
        return pitch;
    }

    public void setPitch(double pitch) {
        this.pitch = pitch;
    }

    public double getVibration() {
        return vibration;
    }

    public void setVibration(double vibration) {
        this.vibration = vibration;
    }

    public Boolean getEngineFailure() {
        return engineFailure;
    }

    public void setEngineFailure(Boolean engineFailure) {
        this.engineFailure = engineFailure;
    }

    @JsonProperty("detected_at")
    public Instant getDetectedAt() {
        return detectedAt;
    }

    @JsonProperty("detected_at")
    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(altitude, that.altitude) == 0
                && Double.compare(airspeed, that.airspeed) == 0
                && Double.compare(pitch, that.pitch) == 0
                && Double.compare(vibration, that.vibration) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(engineFailure, that.engineFailure)
                && Objects.equals(detectedAt, that.detectedAt)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, altitude, airspeed, pitch, vibration, engineFailure, detectedAt, severity);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "timestamp=" + timestamp +
                ", vibration=" + vibration +
                ", altitude=" + altitude +
                ", airspeed=" + airspeed +
                ", pitch=" + pitch +
                ", engineFailure=" + engineFailure +
                ", detectedAt=" + detectedAt +
                ", severity=" + severity +
                '}';
    }
}
