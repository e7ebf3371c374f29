package com.flightsentinel.core.detection;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link OutlierModel#score(List)}: either one {@link Label} per
 * input vector, or {@link Status#NOT_TRAINED} when no fit has succeeded yet.
 * A not-trained result never carries labels.
 *
 * @since 1.0.0
 */
public final class ScoreResult {

    public enum Status {
        OK,
        NOT_TRAINED
    }

    private static final ScoreResult NOT_TRAINED = new ScoreResult(Status.NOT_TRAINED, List.of());

    private final Status status;
    private final List<Label> labels;

    private ScoreResult(Status status, List<Label> labels) {
        this.status = status;
        this.labels = labels;
    }

    public static ScoreResult ok(List<Label> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        return new ScoreResult(Status.OK, Collections.unmodifiableList(labels));
    }

    public static ScoreResult notTrained() {
        return NOT_TRAINED;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * @return labels in input order
     * @throws IllegalStateException if the model was not trained
     */
    public List<Label> getLabels() {
        if (status != Status.OK) {
            throw new IllegalStateException("No labels available: " + status);
        }
        return labels;
    }

    @Override
    public String toString() {
        return "ScoreResult{status=" + status + ", labels=" + labels.size() + '}';
    }
}
