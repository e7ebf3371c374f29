package com.flightsentinel.core.detection;

import java.util.List;

/**
 * Contract for unsupervised outlier-scoring models.
 *
 * <p>
 * A model has two phases: {@link #fit(List)} learns a normal-behaviour
 * boundary from an unlabeled sample, {@link #score(List)} labels new vectors
 * against the last successful fit. "Not ready" conditions are reported as
 * result values, not exceptions.
 * </p>
 * <p>
 * Implementations are <strong>not</strong> thread-safe; the ingestion loop
 * is their only caller.
 * </p>
 */
public interface OutlierModel {

    /**
     * Replace the model state with one learned from {@code vectors}. Every
     * fit starts from scratch; nothing from an earlier fit is merged in.
     *
     * @param vectors raw (unnormalized) training vectors
     * @return {@link FitResult#INSUFFICIENT_DATA} if the sample is too small,
     *         in which case the prior state is kept
     */
    FitResult fit(List<double[]> vectors);

    /**
     * Label each vector as inlier or outlier using the normalization learned
     * by the last successful fit.
     *
     * @param vectors raw (unnormalized) vectors
     * @return labels in input order, or a not-trained result
     */
    ScoreResult score(List<double[]> vectors);

    /**
     * @return {@code true} once a fit has succeeded
     */
    boolean isTrained();
}
