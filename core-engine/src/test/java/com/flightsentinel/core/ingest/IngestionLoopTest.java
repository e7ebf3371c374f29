package com.flightsentinel.core.ingest;

import com.flightsentinel.core.config.ModelSettings;
import com.flightsentinel.core.detection.FeedbackTrainer;
import com.flightsentinel.core.detection.ForestOutlierModel;
import com.flightsentinel.core.model.TelemetryRecord;
import com.flightsentinel.core.store.AnomalyStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IngestionLoop}.
 */
class IngestionLoopTest {

    private static final Duration POLL = Duration.ofMillis(100);
    private static final Duration BACKOFF = Duration.ofMillis(500);

    @TempDir
    Path tempDir;

    private ScriptedSource source;
    private DetectionEngine engine;

    @BeforeEach
    void setUp() {
        source = new ScriptedSource();
        FeedbackTrainer trainer = new FeedbackTrainer(
                new ForestOutlierModel(new ModelSettings()), 10, Clock.systemUTC());
        engine = new DetectionEngine(source, trainer, new AnomalyStore(tempDir.resolve("anomalies.json")));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("A failing cycle backs off, then polling resumes at the normal interval")
    void shouldBackOffAfterFailure() {
        source.then(() -> {
            throw new UncheckedIOException(new IOException("disk on fire"));
        });
        RecordingPacer pacer = new RecordingPacer(3);
        IngestionLoop loop = new IngestionLoop(engine, POLL, BACKOFF, pacer);
        pacer.stopping(loop);

        loop.run();

        assertThat(pacer.pauses).containsExactly(BACKOFF, POLL, POLL);
        EngineStats stats = engine.stats();
        assertThat(stats.getCycles()).isEqualTo(3);
        assertThat(stats.getFailedCycles()).isEqualTo(1);
        assertThat(stats.getState()).isEqualTo(LoopState.STOPPED);
    }

    @Test
    @DisplayName("A missing telemetry file is waited for at the normal interval")
    void shouldPollWhileSourceUnavailable() {
        source.then(() -> {
            throw new TelemetrySourceUnavailableException("Telemetry file x not found");
        });
        RecordingPacer pacer = new RecordingPacer(2);
        IngestionLoop loop = new IngestionLoop(engine, POLL, BACKOFF, pacer);
        pacer.stopping(loop);

        loop.run();

        assertThat(pacer.pauses).containsExactly(POLL, POLL);
        assertThat(engine.stats().getFailedCycles()).isZero();
    }

    @Test
    @DisplayName("A loop stopped before it runs performs no cycles")
    void shouldNotRunAfterStop() {
        IngestionLoop loop = new IngestionLoop(engine, POLL, BACKOFF, new RecordingPacer(1));

        loop.stop();
        loop.stop();
        loop.run();

        assertThat(loop.isStopRequested()).isTrue();
        assertThat(engine.stats().getCycles()).isZero();
        assertThat(loop.getState()).isEqualTo(LoopState.STOPPED);
    }

    @Test
    @DisplayName("An interrupt while resting ends the loop and keeps the interrupt flag")
    void shouldStopOnInterrupt() {
        IngestionLoop loop = new IngestionLoop(engine, POLL, BACKOFF, duration -> {
            throw new InterruptedException();
        });

        loop.run();

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(engine.stats().getCycles()).isEqualTo(1);
        assertThat(engine.getState()).isEqualTo(LoopState.STOPPED);
    }

    @Test
    @DisplayName("stop() cuts a long rest short with the default pacer")
    void shouldWakeFromRestOnStop() throws Exception {
        CountDownLatch firstCycle = new CountDownLatch(1);
        source.then(() -> {
            firstCycle.countDown();
            return List.of();
        });
        IngestionLoop loop = new IngestionLoop(engine, Duration.ofHours(1), BACKOFF);
        Thread thread = new Thread(loop, "ingestion-loop-test");
        thread.start();

        assertThat(firstCycle.await(5, TimeUnit.SECONDS)).isTrue();
        loop.stop();
        thread.join(5_000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(engine.stats().getCycles()).isEqualTo(1);
        assertThat(loop.getState()).isEqualTo(LoopState.STOPPED);
    }

    @Test
    @DisplayName("Negative intervals should be rejected")
    void shouldRejectNegativeIntervals() {
        assertThatThrownBy(() -> new IngestionLoop(engine, Duration.ofMillis(-1), BACKOFF))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pollInterval");
    }

    // ------------------------------------------------------------------
    // Test doubles
    // ------------------------------------------------------------------

    /** Plays queued reads in order, then reports no new data forever. */
    private static final class ScriptedSource implements TelemetrySource {

        private final Deque<Supplier<List<TelemetryRecord>>> script = new ArrayDeque<>();

        ScriptedSource then(Supplier<List<TelemetryRecord>> read) {
            script.addLast(read);
            return this;
        }

        @Override
        public List<TelemetryRecord> readNew() {
            Supplier<List<TelemetryRecord>> next = script.pollFirst();
            return next == null ? List.of() : next.get();
        }

        @Override
        public long getCursor() {
            return 0;
        }
    }

    /** Records every requested rest and stops the loop after a fixed number. */
    private static final class RecordingPacer implements Pacer {

        private final int limit;
        private final List<Duration> pauses = new ArrayList<>();
        private IngestionLoop loop;

        RecordingPacer(int limit) {
            this.limit = limit;
        }

        void stopping(IngestionLoop loop) {
            this.loop = loop;
        }

        @Override
        public void pause(Duration duration) {
            pauses.add(duration);
            if (pauses.size() >= limit && loop != null) {
                loop.stop();
            }
        }
    }
}
