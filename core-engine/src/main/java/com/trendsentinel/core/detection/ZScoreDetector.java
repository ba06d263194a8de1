package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Global z-score detector.
 *
 * <p>
 * Flags every observation whose distance from the series mean exceeds
 * {@code threshold × σ}, where σ is the sample standard deviation of the
 * whole series. A constant series (σ = 0) or a series with fewer than two
 * observations yields no anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    private final double threshold;

    /**
     * @param threshold z-score above which a value is anomalous; must be &gt; 0
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public SortedSet<LocalDate> detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");

        double[] values = series.values();
        double mean = Statistics.mean(values, 0, values.length);
        double stddev = Statistics.sampleStdDev(values, 0, values.length, mean);

        if (Double.isNaN(stddev) || stddev == 0) {
            LOG.trace("[{}] {}: standard deviation undefined or zero; nothing flagged", AnalysisConfig.ZSCORE,
                    series.getTerm());
            return Collections.emptySortedSet();
        }

        SortedSet<LocalDate> flagged = new TreeSet<>();
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - mean) / stddev > threshold) {
                flagged.add(series.dateAt(i));
            }
        }

        LOG.debug("[{}] {}: flagged {} of {} (mean={} stddev={})", AnalysisConfig.ZSCORE, series.getTerm(),
                flagged.size(), values.length, mean, stddev);
        return Collections.unmodifiableSortedSet(flagged);
    }

    @Override
    public String getName() {
        return AnalysisConfig.ZSCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
