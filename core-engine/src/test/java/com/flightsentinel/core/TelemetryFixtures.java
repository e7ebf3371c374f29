package com.flightsentinel.core;

import com.flightsentinel.core.model.TelemetryRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Test data builders for telemetry records.
 */
public final class TelemetryFixtures {

    public static final double ALTITUDE = 1_000.0;
    public static final double AIRSPEED = 250.0;
    public static final double PITCH = 2.0;
    public static final double VIBRATION = 2.0;

    private TelemetryFixtures() {
    }

    /**
     * Normal-flight training records: every feature drawn from a Gaussian
     * around the constants above, vibration ~ N(2, 0.5).
     */
    public static List<TelemetryRecord> normalFlight(int count, long seed) {
        Random random = new Random(seed);
        List<TelemetryRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(record(i,
                    ALTITUDE + random.nextGaussian() * 50,
                    AIRSPEED + random.nextGaussian() * 10,
                    PITCH + random.nextGaussian(),
                    VIBRATION + random.nextGaussian() * 0.5,
                    false, true));
        }
        return records;
    }

    /**
     * A scoring-phase record at the centre of normal flight with the given
     * vibration.
     */
    public static TelemetryRecord scoring(double timestamp, double vibration, Boolean engineFailure) {
        Map<String, Object> fields = fields(timestamp, ALTITUDE, AIRSPEED, PITCH, vibration);
        if (engineFailure != null) {
            fields.put(TelemetryRecord.ENGINE_FAILURE, engineFailure);
        }
        fields.put(TelemetryRecord.TRAINING_PHASE, false);
        return TelemetryRecord.of(fields);
    }

    public static TelemetryRecord record(double timestamp, double altitude, double airspeed, double pitch,
            double vibration, boolean engineFailure, boolean trainingPhase) {
        Map<String, Object> fields = fields(timestamp, altitude, airspeed, pitch, vibration);
        fields.put(TelemetryRecord.ENGINE_FAILURE, engineFailure);
        fields.put(TelemetryRecord.TRAINING_PHASE, trainingPhase);
        return TelemetryRecord.of(fields);
    }

    private static Map<String, Object> fields(double timestamp, double altitude, double airspeed, double pitch,
            double vibration) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TelemetryRecord.TIMESTAMP, timestamp);
        fields.put(TelemetryRecord.ALTITUDE, altitude);
        fields.put(TelemetryRecord.AIRSPEED, airspeed);
        fields.put(TelemetryRecord.PITCH, pitch);
        fields.put(TelemetryRecord.VIBRATION, vibration);
        return fields;
    }
}
