package com.flightsentinel.core.model;

/**
 * Qualitative severity of a confirmed anomaly, ordered from least to most
 * severe so that {@link Enum#compareTo(Enum)} follows the tier ordering.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
