package com.flightsentinel.core.detection;

import com.amazon.randomcutforest.RandomCutForest;
import com.flightsentinel.core.config.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@link OutlierModel} backed by a Random Cut Forest.
 *
 * <p>
 * A fit standardizes the sample with a fresh {@link FeatureScaler} and
 * streams the standardized vectors into a newly built forest. A point the
 * forest already holds scores lower than an unseen one, so the threshold is
 * calibrated on held-out scores instead: the sample is split into
 * {@value #CALIBRATION_FOLDS} folds and every point is scored by a forest
 * grown on the other folds. The {@code (1 - contamination)} quantile of
 * those scores becomes the decision threshold. At inference, a vector
 * scoring strictly above it is an {@link Label#OUTLIER}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Scaler, forest and threshold are swapped in together only after a fit
 * completes, so a refused fit leaves the previous state intact. The forest
 * is seeded from {@link ModelSettings#getRandomSeed()} and every fit uses
 * the same seed, so fitting the same sample twice yields the same labels.
 * </p>
 *
 * @since 1.0.0
 */
public class ForestOutlierModel implements OutlierModel {

    private static final Logger LOG = LoggerFactory.getLogger(ForestOutlierModel.class);

    /** Number of folds used to produce out-of-sample calibration scores. */
    static final int CALIBRATION_FOLDS = 5;

    private final int dimensions;
    private final double contamination;
    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;
    private final int minTrainingSize;

    /** {@code null} until the first successful fit. */
    private volatile TrainedState state;

    /**
     * @param settings model tuning; must not be {@code null}
     * @throws IllegalStateException if the settings are invalid
     */
    public ForestOutlierModel(ModelSettings settings) {
        this(FeatureExtractor.DIMENSIONS, settings);
    }

    ForestOutlierModel(int dimensions, ModelSettings settings) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        settings.validate();
        this.dimensions = dimensions;
        this.contamination = settings.getContamination();
        this.numberOfTrees = settings.getNumberOfTrees();
        this.sampleSize = settings.getSampleSize();
        this.randomSeed = settings.getRandomSeed();
        this.minTrainingSize = settings.getMinTrainingSize();
    }

    @Override
    public FitResult fit(List<double[]> vectors) {
        Objects.requireNonNull(vectors, "vectors must not be null");
        if (vectors.size() < minTrainingSize) {
            LOG.warn("Not enough training data: have {}, need at least {}", vectors.size(), minTrainingSize);
            return FitResult.INSUFFICIENT_DATA;
        }

        FeatureScaler scaler = FeatureScaler.fit(vectors);
        List<double[]> scaled = new ArrayList<>(vectors.size());
        for (double[] v : vectors) {
            scaled.add(scaler.transform(v));
        }

        double threshold = quantile(heldOutScores(scaled), 1.0 - contamination);
        RandomCutForest forest = grow(scaled, randomSeed);

        this.state = new TrainedState(scaler, forest, threshold);
        LOG.info("Model trained with {} data points (threshold={})", vectors.size(),
                String.format("%.4f", threshold));
        return FitResult.TRAINED;
    }

    @Override
    public ScoreResult score(List<double[]> vectors) {
        Objects.requireNonNull(vectors, "vectors must not be null");
        TrainedState current = state;
        if (current == null) {
            LOG.debug("Model not trained yet, skipping scoring of {} vector(s)", vectors.size());
            return ScoreResult.notTrained();
        }
        List<Label> labels = new ArrayList<>(vectors.size());
        for (double[] v : vectors) {
            double score = current.forest.getAnomalyScore(current.scaler.transform(v));
            labels.add(score > current.threshold ? Label.OUTLIER : Label.INLIER);
        }
        return ScoreResult.ok(labels);
    }

    @Override
    public boolean isTrained() {
        return state != null;
    }

    /**
     * @return decision threshold of the current fit, or {@code NaN} if untrained
     */
    public double getThreshold() {
        TrainedState current = state;
        return current == null ? Double.NaN : current.threshold;
    }

    /**
     * Score every point with a forest that never saw it. Point {@code i}
     * belongs to fold {@code i % CALIBRATION_FOLDS}.
     */
    private double[] heldOutScores(List<double[]> scaled) {
        double[] scores = new double[scaled.size()];
        for (int fold = 0; fold < CALIBRATION_FOLDS; fold++) {
            List<double[]> rest = new ArrayList<>(scaled.size());
            for (int i = 0; i < scaled.size(); i++) {
                if (i % CALIBRATION_FOLDS != fold) {
                    rest.add(scaled.get(i));
                }
            }
            RandomCutForest forest = grow(rest, randomSeed + fold + 1);
            for (int i = fold; i < scaled.size(); i += CALIBRATION_FOLDS) {
                scores[i] = forest.getAnomalyScore(scaled.get(i));
            }
        }
        return scores;
    }

    private RandomCutForest grow(List<double[]> points, long seed) {
        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(dimensions)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .outputAfter(1)
                .randomSeed(seed)
                .build();
        for (double[] point : points) {
            forest.update(point);
        }
        return forest;
    }

    /**
     * Linear-interpolated quantile, matching the usual percentile definition.
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (position - lower) * (sorted[upper] - sorted[lower]);
    }

    private static final class TrainedState {
        private final FeatureScaler scaler;
        private final RandomCutForest forest;
        private final double threshold;

        private TrainedState(FeatureScaler scaler, RandomCutForest forest, double threshold) {
            this.scaler = scaler;
            this.forest = forest;
            this.threshold = threshold;
        }
    }
}
