package com.flightsentinel.core.ingest;

import com.flightsentinel.core.config.DetectorConfig;
import com.flightsentinel.core.detection.DetectionOutcome;
import com.flightsentinel.core.detection.FeatureExtractor;
import com.flightsentinel.core.detection.FeedbackTrainer;
import com.flightsentinel.core.detection.FitResult;
import com.flightsentinel.core.detection.ForestOutlierModel;
import com.flightsentinel.core.detection.MissingFieldException;
import com.flightsentinel.core.model.TelemetryRecord;
import com.flightsentinel.core.store.AnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * All mutable state of one detector instance plus the logic of a single
 * ingestion cycle.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>Read every record appended since the last cycle.</li>
 * <li>Drop records missing a feature field, then split the rest by
 * {@code trainingPhase}.</li>
 * <li>While the model is untrained, training records are buffered and a fit
 * is attempted. Once trained, further training records are ignored.</li>
 * <li>Once trained, scoring records go through
 * {@link FeedbackTrainer#detect(List)} and confirmed anomalies are appended
 * to the {@link AnomalyStore}.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #runCycle()} must only be called from one thread at a time (the
 * {@link IngestionLoop}). {@link #stats()} may be called from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final TelemetrySource source;
    private final FeedbackTrainer trainer;
    private final AnomalyStore store;

    private volatile LoopState state = LoopState.WAITING_FOR_DATA;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicLong recordsRead = new AtomicLong();
    private final AtomicLong anomaliesPersisted = new AtomicLong();
    private final AtomicLong falsePositives = new AtomicLong();

    public DetectionEngine(TelemetrySource source, FeedbackTrainer trainer, AnomalyStore store) {
        this.source = Objects.requireNonNull(source, "TelemetrySource must not be null");
        this.trainer = Objects.requireNonNull(trainer, "FeedbackTrainer must not be null");
        this.store = Objects.requireNonNull(store, "AnomalyStore must not be null");
    }

    /**
     * Wire an engine from configuration, using the file-backed source and
     * store and a {@link ForestOutlierModel}.
     *
     * @param config validated configuration
     * @param clock  clock for detection timestamps
     * @return new engine
     */
    public static DetectionEngine create(DetectorConfig config, Clock clock) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        FeedbackTrainer trainer = new FeedbackTrainer(
                new ForestOutlierModel(config.getModel()), config.getRetrainThreshold(), clock);
        return new DetectionEngine(
                new JsonlTelemetrySource(Path.of(config.getTelemetryPath())),
                trainer,
                new AnomalyStore(Path.of(config.getAnomaliesPath())));
    }

    /**
     * Discard anomalies left over from a previous run. Call once before the
     * first cycle.
     */
    public void start() {
        store.reset();
        state = LoopState.WAITING_FOR_DATA;
        LOG.info("Starting anomaly detection engine...");
    }

    /**
     * Run one ingestion cycle.
     *
     * @return what the cycle did
     * @throws RuntimeException on unexpected failures (e.g. I/O errors); the
     *                          caller is expected to back off and retry
     */
    public CycleReport runCycle() {
        cycles.incrementAndGet();
        state = LoopState.WAITING_FOR_DATA;

        List<TelemetryRecord> batch;
        try {
            batch = source.readNew();
        } catch (TelemetrySourceUnavailableException e) {
            LOG.info("{}. Waiting for data...", e.getMessage());
            return CycleReport.builder().sourceAvailable(false).build();
        }

        CycleReport.Builder report = CycleReport.builder().recordsRead(batch.size());
        if (batch.isEmpty()) {
            LOG.info("No new telemetry data. Waiting for data...");
            return report.build();
        }
        recordsRead.addAndGet(batch.size());

        List<TelemetryRecord> training = new ArrayList<>();
        List<TelemetryRecord> scoring = new ArrayList<>();
        int skipped = 0;
        for (TelemetryRecord record : batch) {
            try {
                FeatureExtractor.extract(record);
            } catch (MissingFieldException e) {
                LOG.warn("Skipping telemetry record: {} ({})", e.getMessage(), record);
                skipped++;
                continue;
            }
            (record.isTrainingPhase() ? training : scoring).add(record);
        }
        report.trainingRecords(training.size()).scoringRecords(scoring.size()).skippedRecords(skipped);

        try {
            if (!training.isEmpty() && !trainer.isTrained()) {
                state = LoopState.TRAINING;
                FitResult fit = trainer.train(training);
                report.fitResult(fit);
            }

            if (!scoring.isEmpty() && trainer.isTrained()) {
                state = LoopState.SCORING;
                LOG.info("Detecting anomalies in {} data points", scoring.size());
                DetectionOutcome outcome = trainer.detect(scoring);
                LOG.info("Detected {} anomalies", outcome.getAnomalies().size());
                if (!outcome.getAnomalies().isEmpty()) {
                    store.append(outcome.getAnomalies());
                    anomaliesPersisted.addAndGet(outcome.getAnomalies().size());
                }
                falsePositives.addAndGet(outcome.getFalsePositives());
                report.scored(outcome.isScored())
                        .anomaliesPersisted(outcome.getAnomalies().size())
                        .falsePositives(outcome.getFalsePositives())
                        .retrains(outcome.getRetrains());

                // anomalies are persisted first; the cursor has already moved past them
                Optional<RuntimeException> retrainFailure = outcome.getRetrainFailure();
                if (retrainFailure.isPresent()) {
                    throw retrainFailure.get();
                }
            }
        } finally {
            state = LoopState.WAITING_FOR_DATA;
        }

        CycleReport result = report.build();
        LOG.debug("Cycle complete: {}", result);
        return result;
    }

    void recordFailedCycle() {
        failedCycles.incrementAndGet();
    }

    void markStopped() {
        state = LoopState.STOPPED;
    }

    public LoopState getState() {
        return state;
    }

    public boolean isTrained() {
        return trainer.isTrained();
    }

    public FeedbackTrainer getTrainer() {
        return trainer;
    }

    public AnomalyStore getStore() {
        return store;
    }

    /**
     * @return a consistent-enough snapshot for monitoring; counters are read
     *         individually
     */
    public EngineStats stats() {
        return new EngineStats(
                state,
                trainer.isTrained(),
                source.getCursor(),
                trainer.getTrainingBufferSize(),
                trainer.getMisjudgedCount(),
                cycles.get(),
                failedCycles.get(),
                recordsRead.get(),
                anomaliesPersisted.get(),
                falsePositives.get(),
                trainer.getRetrainCount());
    }
}
