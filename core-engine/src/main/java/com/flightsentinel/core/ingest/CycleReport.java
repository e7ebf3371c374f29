package com.flightsentinel.core.ingest;

import com.flightsentinel.core.detection.FitResult;

import java.util.Optional;

/**
 * Summary of one ingestion cycle.
 *
 * @since 1.0.0
 */
public final class CycleReport {

    private final boolean sourceAvailable;
    private final int recordsRead;
    private final int trainingRecords;
    private final int scoringRecords;
    private final int skippedRecords;
    private final FitResult fitResult;
    private final boolean scored;
    private final int anomaliesPersisted;
    private final int falsePositives;
    private final int retrains;

    private CycleReport(Builder b) {
        this.sourceAvailable = b.sourceAvailable;
        this.recordsRead = b.recordsRead;
        this.trainingRecords = b.trainingRecords;
        this.scoringRecords = b.scoringRecords;
        this.skippedRecords = b.skippedRecords;
        this.fitResult = b.fitResult;
        this.scored = b.scored;
        this.anomaliesPersisted = b.anomaliesPersisted;
        this.falsePositives = b.falsePositives;
        this.retrains = b.retrains;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code false} if the telemetry file did not exist this cycle
     */
    public boolean isSourceAvailable() {
        return sourceAvailable;
    }

    /**
     * @return {@code true} if the cycle found no new records
     */
    public boolean isNoData() {
        return recordsRead == 0;
    }

    public int getRecordsRead() {
        return recordsRead;
    }

    public int getTrainingRecords() {
        return trainingRecords;
    }

    public int getScoringRecords() {
        return scoringRecords;
    }

    /**
     * @return records dropped because a feature field was missing
     */
    public int getSkippedRecords() {
        return skippedRecords;
    }

    /**
     * @return the fit attempted this cycle, if any
     */
    public Optional<FitResult> getFitResult() {
        return Optional.ofNullable(fitResult);
    }

    /**
     * @return {@code true} if scoring-phase records were run through the model
     */
    public boolean isScored() {
        return scored;
    }

    public int getAnomaliesPersisted() {
        return anomaliesPersisted;
    }

    public int getFalsePositives() {
        return falsePositives;
    }

    public int getRetrains() {
        return retrains;
    }

    @Override
    public String toString() {
        return "CycleReport{" +
                "sourceAvailable=" + sourceAvailable +
                ", recordsRead=" + recordsRead +
                ", training=" + trainingRecords +
                ", scoring=" + scoringRecords +
                ", skipped=" + skippedRecords +
                ", fit=" + fitResult +
                ", scored=" + scored +
                ", anomalies=" + anomaliesPersisted +
                ", falsePositives=" + falsePositives +
                ", retrains=" + retrains +
                '}';
    }

    static final class Builder {
        private boolean sourceAvailable = true;
        private int recordsRead;
        private int trainingRecords;
        private int scoringRecords;
        private int skippedRecords;
        private FitResult fitResult;
        private boolean scored;
        private int anomaliesPersisted;
        private int falsePositives;
        private int retrains;

        Builder sourceAvailable(boolean v) {
            this.sourceAvailable = v;
            return this;
        }

        Builder recordsRead(int v) {
            this.recordsRead = v;
            return this;
        }

        Builder trainingRecords(int v) {
            this.trainingRecords = v;
            return this;
        }

        Builder scoringRecords(int v) {
            this.scoringRecords = v;
            return this;
        }

        Builder skippedRecords(int v) {
            this.skippedRecords = v;
            return this;
        }

        Builder fitResult(FitResult v) {
            this.fitResult = v;
            return this;
        }

        Builder scored(boolean v) {
            this.scored = v;
            return this;
        }

        Builder anomaliesPersisted(int v) {
            this.anomaliesPersisted = v;
            return this;
        }

        Builder falsePositives(int v) {
            this.falsePositives = v;
            return this;
        }

        Builder retrains(int v) {
            this.retrains = v;
            return this;
        }

        CycleReport build() {
            return new CycleReport(this);
        }
    }
}
