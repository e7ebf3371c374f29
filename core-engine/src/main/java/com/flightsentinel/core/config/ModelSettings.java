package com.flightsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning parameters of the outlier-scoring model.
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that every value is in its legal range.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelSettings {

    /** Expected fraction of outliers in the training sample. */
    private double contamination = 0.05;

    /** Ensemble size of the forest. */
    private int numberOfTrees = 100;

    /** Points kept per tree. */
    private int sampleSize = 256;

    /** Seed of the forest random number generator. */
    private long randomSeed = 42L;

    /** Minimum population required before a fit is attempted. */
    private int minTrainingSize = 120;

    /**
     * Collect validation errors for this block.
     *
     * @return list of human-readable problems; empty when valid
     */
    List<String> errors() {
        List<String> errors = new ArrayList<>();
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("model.contamination must be in (0, 0.5], got: " + contamination);
        }
        if (numberOfTrees < 1) {
            errors.add("model.numberOfTrees must be >= 1, got: " + numberOfTrees);
        }
        if (sampleSize < 1) {
            errors.add("model.sampleSize must be >= 1, got: " + sampleSize);
        }
        if (minTrainingSize < 1) {
            errors.add("model.minTrainingSize must be >= 1, got: " + minTrainingSize);
        }
        return errors;
    }

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = errors();
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid ModelSettings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public void setNumberOfTrees(int numberOfTrees) {
        this.numberOfTrees = numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getMinTrainingSize() {
        return minTrainingSize;
    }

    public void setMinTrainingSize(int minTrainingSize) {
        this.minTrainingSize = minTrainingSize;
    }

    @Override
    public String toString() {
        return "ModelSettings{" +
                "contamination=" + contamination +
                ", numberOfTrees=" + numberOfTrees +
                ", sampleSize=" + sampleSize +
                ", randomSeed=" + randomSeed +
                ", minTrainingSize=" + minTrainingSize +
                '}';
    }
}
