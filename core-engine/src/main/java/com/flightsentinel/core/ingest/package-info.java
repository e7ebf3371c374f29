/**
 * Polling ingestion of telemetry and the detection cycle.
 *
 * <p>
 * {@link com.flightsentinel.core.ingest.IngestionLoop} repeatedly asks the
 * {@link com.flightsentinel.core.ingest.DetectionEngine} to run a cycle: read
 * new lines from the
 * {@link com.flightsentinel.core.ingest.TelemetrySource}, train or score, and
 * persist confirmed anomalies.
 * </p>
 *
 * @since 1.0.0
 */
package com.flightsentinel.core.ingest;
