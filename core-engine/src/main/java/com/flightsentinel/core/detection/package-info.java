/**
 * Online anomaly detection for flight telemetry.
 *
 * <p>
 * {@link com.flightsentinel.core.detection.FeatureExtractor} turns records
 * into vectors, an {@link com.flightsentinel.core.detection.OutlierModel}
 * (by default {@link com.flightsentinel.core.detection.ForestOutlierModel})
 * labels them, and {@link com.flightsentinel.core.detection.FeedbackTrainer}
 * reviews outlier calls against ground truth, folding false positives back
 * into training. {@link com.flightsentinel.core.detection.SeverityClassifier}
 * grades confirmed anomalies by vibration.
 * </p>
 *
 * @since 1.0.0
 */
package com.flightsentinel.core.detection;
