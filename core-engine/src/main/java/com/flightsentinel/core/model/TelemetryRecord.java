package com.flightsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One telemetry sample as written by the flight producer.
 *
 * <p>
 * Records arrive as free-form JSON lines. Every property is kept verbatim in
 * insertion order so producer-only fields (e.g. {@code simulationTime})
 * survive untouched; the typed accessors below cover the fields the
 * detection engine relies on.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are populated once by the JSON reader and only read afterwards.
 * They are handed between components of a single ingestion cycle and are
 * never shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryRecord {

    public static final String TIMESTAMP = "timestamp";
    public static final String ALTITUDE = "altitude";
    public static final String AIRSPEED = "airspeed";
    public static final String PITCH = "pitch";
    public static final String VIBRATION = "vibration";
    public static final String ENGINE_FAILURE = "engineFailure";
    public static final String TRAINING_PHASE = "trainingPhase";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields in arrival order
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve a numeric field value, coercing common JSON number types.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * </p>
     *
     * @param fieldName the JSON key
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a boolean field value. Accepts JSON booleans and the strings
     * {@code "true"} / {@code "false"} (case-insensitive).
     *
     * @param fieldName the JSON key
     * @return optional containing the flag, empty if absent or not boolean
     */
    public Optional<Boolean> getBooleanField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Boolean b) {
            return Optional.of(b);
        }
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(s)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Domain accessors (derived from fields, never serialized)
    // ---------------------------------------------------------------

    /**
     * @return the producer timestamp exactly as it appeared in the source, or
     *         {@code null} if absent
     */
    @JsonIgnore
    public Object getTimestamp() {
        return fields.get(TIMESTAMP);
    }

    /**
     * Ground-truth engine failure label supplied by the producer.
     *
     * @return the label, or empty when the producer did not supply one
     */
    @JsonIgnore
    public Optional<Boolean> getEngineFailure() {
        return getBooleanField(ENGINE_FAILURE);
    }

    /**
     * Whether this record belongs to the normal-behaviour baseline.
     * Defaults to {@code true} when the field is absent.
     *
     * @return {@code true} for training-phase records
     */
    @JsonIgnore
    public boolean isTrainingPhase() {
        return getBooleanField(TRAINING_PHASE).orElse(Boolean.TRUE);
    }

    // ---------------------------------------------------------------
    // Factory
    // ---------------------------------------------------------------

    /**
     * Create a record from an existing map of fields (defensive copy).
     *
     * @param fields field values; must not be {@code null}
     * @return new record
     */
    public static TelemetryRecord of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        TelemetryRecord record = new TelemetryRecord();
        fields.forEach(record::setField);
        return record;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TelemetryRecord" + fields;
    }
}
