package com.flightsentinel.core.detection;

import com.flightsentinel.core.model.Anomaly;
import com.flightsentinel.core.model.Severity;
import com.flightsentinel.core.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Owns the model lifecycle: initial training, outlier review against the
 * ground-truth {@code engineFailure} label, and feedback-driven retraining.
 *
 * <h3>Feedback policy</h3>
 * <p>
 * Every record the model calls an outlier is checked against its label:
 * </p>
 * <ul>
 * <li>{@code engineFailure=false}: a false positive. The record joins the
 * training buffer and the misjudged counter goes up. Once the counter
 * exceeds the retrain threshold the model is re-fit over the whole buffer
 * and the counter is reset, whether or not that fit succeeded.</li>
 * <li>{@code engineFailure=true} or absent: a confirmed {@link Anomaly}.</li>
 * </ul>
 * <p>
 * Labels for a batch are computed once up front, so a retrain triggered
 * part-way through a batch only affects later batches. If a retrain throws,
 * the rest of the batch is still processed and the failure is reported
 * through {@link DetectionOutcome#getRetrainFailure()}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The training buffer only grows; records are never evicted. This class is
 * <strong>not</strong> thread-safe apart from the read-only counters.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackTrainer.class);

    private static final int ALTITUDE_INDEX = FeatureExtractor.FEATURES.indexOf(TelemetryRecord.ALTITUDE);
    private static final int AIRSPEED_INDEX = FeatureExtractor.FEATURES.indexOf(TelemetryRecord.AIRSPEED);
    private static final int VIBRATION_INDEX = FeatureExtractor.FEATURES.indexOf(TelemetryRecord.VIBRATION);

    private final OutlierModel model;
    private final int retrainThreshold;
    private final Clock clock;

    private final List<TelemetryRecord> trainingBuffer = new ArrayList<>();
    /** Feature vectors of {@link #trainingBuffer}, index-aligned. */
    private final List<double[]> trainingFeatures = new ArrayList<>();

    private volatile int trainingBufferSize;
    private volatile int misjudgedCount;
    private volatile int retrainCount;

    /**
     * @param model            the model to train and consult
     * @param retrainThreshold false positives tolerated before a retrain; the
     *                         next one triggers it
     * @param clock            source of detection timestamps
     */
    public FeedbackTrainer(OutlierModel model, int retrainThreshold, Clock clock) {
        this.model = Objects.requireNonNull(model, "OutlierModel must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        if (retrainThreshold < 0) {
            throw new IllegalArgumentException("retrainThreshold must be >= 0, got: " + retrainThreshold);
        }
        this.retrainThreshold = retrainThreshold;
    }

    /**
     * Append training-phase records to the buffer and fit the model over the
     * whole buffer.
     *
     * @param records valid training records
     * @return outcome of the fit
     * @throws MissingFieldException if a record lacks a feature field
     */
    public FitResult train(List<TelemetryRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        // extraction fails before any of the batch enters the buffer
        List<double[]> vectors = FeatureExtractor.extractAll(records);
        trainingBuffer.addAll(records);
        trainingFeatures.addAll(vectors);
        trainingBufferSize = trainingBuffer.size();
        LOG.debug("Training buffer now holds {} record(s)", trainingBuffer.size());
        return model.fit(List.copyOf(trainingFeatures));
    }

    /**
     * Score a batch and apply the feedback policy.
     *
     * @param records valid scoring-phase records
     * @return confirmed anomalies plus feedback counters, or a not-scored
     *         outcome if the model is untrained. A retrain that throws does
     *         not abort the batch; the failure is carried in the outcome.
     * @throws MissingFieldException if a record lacks a feature field
     */
    public DetectionOutcome detect(List<TelemetryRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<double[]> vectors = FeatureExtractor.extractAll(records);
        ScoreResult result = model.score(vectors);
        if (!result.isOk()) {
            LOG.info("Model not trained yet. Skipping anomaly detection.");
            return DetectionOutcome.notTrained();
        }

        List<Label> labels = result.getLabels();
        List<Anomaly> anomalies = new ArrayList<>();
        int falsePositives = 0;
        int retrains = 0;
        RuntimeException retrainFailure = null;

        for (int i = 0; i < records.size(); i++) {
            if (labels.get(i) != Label.OUTLIER) {
                continue;
            }
            TelemetryRecord record = records.get(i);
            double[] features = vectors.get(i);
            String vibration = String.format("%.2f", features[VIBRATION_INDEX]);
            String altitude = String.format("%.0f", features[ALTITUDE_INDEX]);
            String airspeed = String.format("%.0f", features[AIRSPEED_INDEX]);

            if (!record.getEngineFailure().orElse(Boolean.TRUE)) {
                falsePositives++;
                LOG.info("Not an anomaly: vibration={}g altitude={}ft speed={}kts, adding to training data",
                        vibration, altitude, airspeed);
                try {
                    if (recordFalsePositive(record, features)) {
                        retrains++;
                    }
                } catch (RuntimeException e) {
                    LOG.error("Retrain failed, finishing the batch before reporting it: {}", e.getMessage(), e);
                    if (retrainFailure == null) {
                        retrainFailure = e;
                    } else {
                        retrainFailure.addSuppressed(e);
                    }
                }
                continue;
            }

            Severity severity = SeverityClassifier.classify(features[VIBRATION_INDEX]);
            anomalies.add(Anomaly.fromRecord(record, clock.instant(), severity));
            LOG.warn("ANOMALY DETECTED [{}]: vibration={}g altitude={}ft speed={}kts", severity,
                    vibration, altitude, airspeed);
        }
        return DetectionOutcome.scored(anomalies, falsePositives, retrains, retrainFailure);
    }

    /**
     * @return {@code true} if this false positive triggered a retrain
     * @throws RuntimeException if the retrain fit fails; the misjudged
     *                          counter is reset regardless
     */
    private boolean recordFalsePositive(TelemetryRecord record, double[] features) {
        trainingBuffer.add(record);
        trainingFeatures.add(features);
        trainingBufferSize = trainingBuffer.size();
        misjudgedCount++;
        if (misjudgedCount <= retrainThreshold) {
            return false;
        }
        LOG.info("{} misjudged points since last retrain, retraining model over {} record(s)",
                misjudgedCount, trainingBuffer.size());
        try {
            FitResult fit = model.fit(List.copyOf(trainingFeatures));
            if (fit != FitResult.TRAINED) {
                LOG.warn("Retrain skipped ({}), resetting misjudged counter anyway", fit);
            }
        } finally {
            misjudgedCount = 0;
        }
        retrainCount++;
        return true;
    }

    public boolean isTrained() {
        return model.isTrained();
    }

    /**
     * @return unmodifiable view of the training buffer in insertion order
     */
    public List<TelemetryRecord> getTrainingBuffer() {
        return Collections.unmodifiableList(trainingBuffer);
    }

    public int getTrainingBufferSize() {
        return trainingBufferSize;
    }

    /**
     * @return false positives seen since the last retrain
     */
    public int getMisjudgedCount() {
        return misjudgedCount;
    }

    /**
     * @return feedback-triggered retrains since construction
     */
    public int getRetrainCount() {
        return retrainCount;
    }
}
