package com.flightsentinel.core.ingest;

/**
 * Observable phase of the ingestion loop.
 */
public enum LoopState {

    /** Resting between cycles or reading the source. */
    WAITING_FOR_DATA,

    /** Fitting the model on training-phase records. */
    TRAINING,

    /** Scoring records and applying feedback. */
    SCORING,

    /** Terminal; reached only through {@link IngestionLoop#stop()} or interruption. */
    STOPPED
}
