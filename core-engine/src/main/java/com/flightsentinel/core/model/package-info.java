/**
 * Domain model classes for Flight Sentinel.
 *
 * <ul>
 * <li>{@link com.flightsentinel.core.model.TelemetryRecord}: one free-form
 * telemetry sample</li>
 * <li>{@link com.flightsentinel.core.model.Anomaly}: a confirmed anomaly as
 * persisted by the anomaly store</li>
 * <li>{@link com.flightsentinel.core.model.Severity}: severity tiers</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.flightsentinel.core.model;
