package com.flightsentinel.core.detection;

import com.flightsentinel.core.model.Severity;

/**
 * Maps the vibration magnitude (g) of a confirmed anomaly to a
 * {@link Severity} tier. Thresholds are exclusive lower bounds, evaluated
 * from the highest tier down.
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    static final double CRITICAL_ABOVE = 8.0;
    static final double HIGH_ABOVE = 6.0;
    static final double MEDIUM_ABOVE = 4.0;

    private SeverityClassifier() {
        // utility class; not instantiable
    }

    public static Severity classify(double vibration) {
        if (vibration > CRITICAL_ABOVE) {
            return Severity.CRITICAL;
        }
        if (vibration > HIGH_ABOVE) {
            return Severity.HIGH;
        }
        if (vibration > MEDIUM_ABOVE) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
