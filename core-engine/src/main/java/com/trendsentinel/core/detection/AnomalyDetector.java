package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.Series;

import java.time.LocalDate;
import java.util.SortedSet;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: each call to
 * {@link #detect(Series)} looks at one whole series and never mutates it.
 * Degenerate statistics (zero variance, zero MAD, too few points) produce an
 * empty result rather than an exception.
 * </p>
 * <p>
 * Detectors are independent and may disagree; reconciling them is the job of
 * the consensus aggregator.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Flag the anomalous observations of a series.
     *
     * @param series the series to inspect
     * @return unmodifiable, chronologically ordered set of flagged dates
     */
    SortedSet<LocalDate> detect(Series series);

    /**
     * Return the detector type name used in reports and consensus records.
     *
     * @return detector name
     */
    String getName();
}
