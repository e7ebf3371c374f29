package com.flightsentinel.core.ingest;

import com.flightsentinel.core.model.TelemetryRecord;

import java.util.List;

/**
 * Position-tracking reader over an append-only telemetry stream.
 *
 * @since 1.0.0
 */
public interface TelemetrySource {

    /**
     * Return every record appended since the previous call and advance the
     * cursor to the current end of the stream.
     *
     * @return new records in stream order; empty if nothing was appended
     * @throws TelemetrySourceUnavailableException if the stream does not exist
     *                                             (yet)
     * @throws java.io.UncheckedIOException         if the stream exists but
     *                                             cannot be read
     */
    List<TelemetryRecord> readNew();

    /**
     * @return number of lines consumed so far; never decreases
     */
    long getCursor();
}
