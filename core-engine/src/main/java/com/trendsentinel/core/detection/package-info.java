/**
 * Independent anomaly detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.trendsentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.trendsentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@link com.trendsentinel.core.detection.ZScoreDetector}: global
 * mean ± N × σ</li>
 * <li>{@link com.trendsentinel.core.detection.ModifiedZScoreDetector}:
 * median and MAD</li>
 * <li>{@link com.trendsentinel.core.detection.EnsembleOutlierDetector}:
 * contamination cut-off over an
 * {@link com.trendsentinel.core.detection.OutlierScorer}</li>
 * <li>{@link com.trendsentinel.core.detection.RollingZScoreDetector}:
 * centered rolling mean ± N × σ</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new detector type, implement {@code AnomalyDetector} and register
 * the type string in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.detection;
