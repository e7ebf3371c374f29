package com.flightsentinel.core.detection;

import com.flightsentinel.core.model.Anomaly;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running {@link FeedbackTrainer#detect(List)} over one batch.
 *
 * @since 1.0.0
 */
public final class DetectionOutcome {

    private static final DetectionOutcome NOT_TRAINED = new DetectionOutcome(false, List.of(), 0, 0, null);

    private final boolean scored;
    private final List<Anomaly> anomalies;
    private final int falsePositives;
    private final int retrains;
    private final RuntimeException retrainFailure;

    private DetectionOutcome(boolean scored, List<Anomaly> anomalies, int falsePositives, int retrains,
            RuntimeException retrainFailure) {
        this.scored = scored;
        this.anomalies = anomalies;
        this.falsePositives = falsePositives;
        this.retrains = retrains;
        this.retrainFailure = retrainFailure;
    }

    static DetectionOutcome scored(List<Anomaly> anomalies, int falsePositives, int retrains,
            RuntimeException retrainFailure) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        return new DetectionOutcome(true, Collections.unmodifiableList(anomalies), falsePositives, retrains,
                retrainFailure);
    }

    static DetectionOutcome notTrained() {
        return NOT_TRAINED;
    }

    /**
     * @return {@code false} when the batch was skipped because the model was
     *         not trained yet
     */
    public boolean isScored() {
        return scored;
    }

    /**
     * @return confirmed anomalies, in batch order
     */
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public int getFalsePositives() {
        return falsePositives;
    }

    /**
     * @return number of retrains triggered while processing the batch
     */
    public int getRetrains() {
        return retrains;
    }

    /**
     * @return the first exception thrown by a retrain in this batch (later
     *         ones suppressed into it), or empty if every retrain completed
     */
    public Optional<RuntimeException> getRetrainFailure() {
        return Optional.ofNullable(retrainFailure);
    }

    @Override
    public String toString() {
        return "DetectionOutcome{scored=" + scored
                + ", anomalies=" + anomalies.size()
                + ", falsePositives=" + falsePositives
                + ", retrains=" + retrains
                + ", retrainFailed=" + (retrainFailure != null) + '}';
    }
}
