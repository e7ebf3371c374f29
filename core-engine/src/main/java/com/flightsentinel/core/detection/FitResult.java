package com.flightsentinel.core.detection;

/**
 * Outcome of {@link OutlierModel#fit(java.util.List)}.
 *
 * @since 1.0.0
 */
public enum FitResult {

    /** A new model state replaced the previous one. */
    TRAINED,

    /** The sample was below the minimum size; prior state is unchanged. */
    INSUFFICIENT_DATA
}
