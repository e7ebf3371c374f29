package com.flightsentinel.core.ingest;

import java.time.Duration;

/**
 * Rest between two ingestion cycles. Injected so tests can drive the loop
 * without real delays.
 */
@FunctionalInterface
public interface Pacer {

    /**
     * Block for up to {@code duration}. Implementations may return early.
     *
     * @param duration requested rest
     * @throws InterruptedException if the calling thread is interrupted
     */
    void pause(Duration duration) throws InterruptedException;
}
