package com.flightsentinel.core.detection;

/**
 * Binary verdict of the outlier-scoring model for one feature vector.
 */
public enum Label {
    INLIER,
    OUTLIER
}
