package com.flightsentinel.core.ingest;

/**
 * Point-in-time snapshot of the detection engine, safe to read from any
 * thread. Serialized as-is by the health endpoint.
 *
 * @since 1.0.0
 */
public final class EngineStats {

    private final LoopState state;
    private final boolean trained;
    private final long cursor;
    private final int trainingBufferSize;
    private final int misjudgedCount;
    private final long cycles;
    private final long failedCycles;
    private final long recordsRead;
    private final long anomaliesPersisted;
    private final long falsePositives;
    private final long retrains;

    public EngineStats(LoopState state, boolean trained, long cursor, int trainingBufferSize, int misjudgedCount,
            long cycles, long failedCycles, long recordsRead, long anomaliesPersisted, long falsePositives,
            long retrains) {
        this.state = state;
        this.trained = trained;
        this.cursor = cursor;
        this.trainingBufferSize = trainingBufferSize;
        this.misjudgedCount = misjudgedCount;
        this.cycles = cycles;
        this.failedCycles = failedCycles;
        this.recordsRead = recordsRead;
        this.anomaliesPersisted = anomaliesPersisted;
        this.falsePositives = falsePositives;
        this.retrains = retrains;
    }

    public LoopState getState() {
        return state;
    }

    public boolean isTrained() {
        return trained;
    }

    public long getCursor() {
        return cursor;
    }

    public int getTrainingBufferSize() {
        return trainingBufferSize;
    }

    public int getMisjudgedCount() {
        return misjudgedCount;
    }

    public long getCycles() {
        return cycles;
    }

    public long getFailedCycles() {
        return failedCycles;
    }

    public long getRecordsRead() {
        return recordsRead;
    }

    public long getAnomaliesPersisted() {
        return anomaliesPersisted;
    }

    public long getFalsePositives() {
        return falsePositives;
    }

    public long getRetrains() {
        return retrains;
    }

    @Override
    public String toString() {
        return "EngineStats{" +
                "state=" + state +
                ", trained=" + trained +
                ", cursor=" + cursor +
                ", trainingBufferSize=" + trainingBufferSize +
                ", misjudged=" + misjudgedCount +
                ", cycles=" + cycles +
                ", failedCycles=" + failedCycles +
                ", anomalies=" + anomaliesPersisted +
                ", retrains=" + retrains +
                '}';
    }
}
