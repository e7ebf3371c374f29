package com.flightsentinel.core.ingest;

/**
 * The telemetry stream is missing, typically because the producer has not
 * started yet. Callers treat this as a normal waiting state.
 *
 * @since 1.0.0
 */
public class TelemetrySourceUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TelemetrySourceUnavailableException(String message) {
        super(message);
    }

    public TelemetrySourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
