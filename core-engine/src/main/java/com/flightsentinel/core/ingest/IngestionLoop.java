package com.flightsentinel.core.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a {@link DetectionEngine} cycle after cycle on the calling thread
 * until {@link #stop()} is called or the thread is interrupted.
 *
 * <p>
 * After a cycle the loop rests for the poll interval, or for the backoff
 * interval if the cycle threw. A failing cycle never ends the loop. The stop
 * flag is checked before every cycle and again before resting; with the
 * default {@link Pacer} a pending rest ends as soon as {@code stop()} is
 * called. An interrupt during the rest also stops the loop, with the
 * interrupt flag restored.
 * </p>
 *
 * <p>
 * {@code stop()} never interrupts a cycle in progress, so a fit, score or
 * store write always runs to completion.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestionLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionLoop.class);

    private final DetectionEngine engine;
    private final Duration pollInterval;
    private final Duration backoffInterval;
    private final Pacer pacer;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    /**
     * Create a loop that rests on an internal stop signal, so {@link #stop()}
     * cuts the current rest short.
     */
    public IngestionLoop(DetectionEngine engine, Duration pollInterval, Duration backoffInterval) {
        this(engine, pollInterval, backoffInterval, null);
    }

    /**
     * @param pacer rest strategy; {@code null} selects the stop-aware default
     */
    public IngestionLoop(DetectionEngine engine, Duration pollInterval, Duration backoffInterval, Pacer pacer) {
        this.engine = Objects.requireNonNull(engine, "DetectionEngine must not be null");
        this.pollInterval = requireNonNegative(pollInterval, "pollInterval");
        this.backoffInterval = requireNonNegative(backoffInterval, "backoffInterval");
        this.pacer = pacer != null
                ? pacer
                : duration -> stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void run() {
        LOG.info("Ingestion loop started (poll={}ms, backoff={}ms)",
                pollInterval.toMillis(), backoffInterval.toMillis());
        try {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                Duration rest = pollInterval;
                try {
                    engine.runCycle();
                } catch (RuntimeException e) {
                    engine.recordFailedCycle();
                    LOG.error("Error in detection loop: {}", e.getMessage(), e);
                    rest = backoffInterval;
                }

                if (stopRequested.get()) {
                    break;
                }
                try {
                    pacer.pause(rest);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.info("Ingestion loop interrupted");
                    break;
                }
            }
        } finally {
            engine.markStopped();
            LOG.info("Stopping anomaly detection engine...");
        }
    }

    /**
     * Request a stop. Idempotent and safe to call from any thread, including
     * a JVM shutdown hook.
     */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.info("Stop requested");
            stopSignal.countDown();
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public LoopState getState() {
        return engine.getState();
    }

    private static Duration requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + d);
        }
        return d;
    }
}
