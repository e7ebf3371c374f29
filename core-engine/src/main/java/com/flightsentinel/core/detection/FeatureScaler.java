package com.flightsentinel.core.detection;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Per-feature standardization: {@code (x - mean) / stddev}.
 *
 * <p>
 * Parameters are learned once by {@link #fit(List)} and never updated
 * afterwards; a re-fit produces a new scaler. A feature with zero spread is
 * scaled by 1 so constant columns are centred but not blown up.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    /**
     * Learn mean and population standard deviation of every feature.
     *
     * @param vectors sample; must be non-empty with equal-length vectors
     * @return fitted scaler
     * @throws IllegalArgumentException if the sample is empty or ragged
     */
    public static FeatureScaler fit(List<double[]> vectors) {
        Objects.requireNonNull(vectors, "vectors must not be null");
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty sample");
        }
        int dimensions = vectors.get(0).length;
        double[] mean = new double[dimensions];
        for (double[] v : vectors) {
            checkDimensions(v, dimensions);
            for (int i = 0; i < dimensions; i++) {
                mean[i] += v[i];
            }
        }
        for (int i = 0; i < dimensions; i++) {
            mean[i] /= vectors.size();
        }

        double[] scale = new double[dimensions];
        for (double[] v : vectors) {
            for (int i = 0; i < dimensions; i++) {
                double diff = v[i] - mean[i];
                scale[i] += diff * diff;
            }
        }
        for (int i = 0; i < dimensions; i++) {
            double stddev = Math.sqrt(scale[i] / vectors.size());
            scale[i] = stddev == 0 ? 1.0 : stddev;
        }
        return new FeatureScaler(mean, scale);
    }

    /**
     * @param vector raw feature vector
     * @return a new, standardized vector
     */
    public double[] transform(double[] vector) {
        checkDimensions(vector, mean.length);
        double[] out = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (vector[i] - mean[i]) / scale[i];
        }
        return out;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getScale() {
        return scale.clone();
    }

    private static void checkDimensions(double[] vector, int dimensions) {
        Objects.requireNonNull(vector, "vector must not be null");
        if (vector.length != dimensions) {
            throw new IllegalArgumentException(
                    "Expected vector of length " + dimensions + ", got: " + vector.length);
        }
    }

    @Override
    public String toString() {
        return "FeatureScaler{mean=" + Arrays.toString(mean) + ", scale=" + Arrays.toString(scale) + '}';
    }
}
