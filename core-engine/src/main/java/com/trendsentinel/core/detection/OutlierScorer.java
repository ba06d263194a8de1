package com.trendsentinel.core.detection;

/**
 * Unsupervised outlier scoring over a batch of one-dimensional points.
 *
 * <p>
 * Implementations assign a continuous score to every point, higher meaning
 * more anomalous, and must return identical scores for identical input.
 * Equal values must receive equal scores.
 * </p>
 */
@FunctionalInterface
public interface OutlierScorer {

    /**
     * @param values points to score, in series order
     * @return one score per point, aligned with {@code values}
     */
    double[] score(double[] values);
}
