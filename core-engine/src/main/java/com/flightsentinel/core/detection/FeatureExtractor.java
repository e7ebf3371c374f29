package com.flightsentinel.core.detection;

import com.flightsentinel.core.model.TelemetryRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link TelemetryRecord} to the fixed-order feature vector
 * {@code [altitude, airspeed, pitch, vibration]}.
 *
 * @since 1.0.0
 */
public final class FeatureExtractor {

    /** Feature names, in vector order. */
    public static final List<String> FEATURES = List.of(
            TelemetryRecord.ALTITUDE,
            TelemetryRecord.AIRSPEED,
            TelemetryRecord.PITCH,
            TelemetryRecord.VIBRATION);

    public static final int DIMENSIONS = FEATURES.size();

    private FeatureExtractor() {
        // utility class; not instantiable
    }

    /**
     * @param record the record to convert; must not be {@code null}
     * @return a new feature vector of length {@link #DIMENSIONS}
     * @throws MissingFieldException if a required field is absent or not numeric
     */
    public static double[] extract(TelemetryRecord record) {
        Objects.requireNonNull(record, "TelemetryRecord must not be null");
        double[] vector = new double[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            String field = FEATURES.get(i);
            vector[i] = record.getNumericField(field)
                    .orElseThrow(() -> new MissingFieldException(field));
        }
        return vector;
    }

    /**
     * Extract every record in order. Fails on the first malformed record.
     *
     * @param records records to convert; must not be {@code null}
     * @return feature vectors, one per record
     * @throws MissingFieldException if any record lacks a required field
     */
    public static List<double[]> extractAll(List<TelemetryRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<double[]> vectors = new ArrayList<>(records.size());
        for (TelemetryRecord record : records) {
            vectors.add(extract(record));
        }
        return vectors;
    }
}
