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
 * Robust z-score detector based on the median absolute deviation.
 *
 * <p>
 * Score = {@value #CONSISTENCY_CONSTANT} × (v − median) / MAD. Less sensitive
 * to fat tails than the plain z-score. When MAD is zero (constant or highly
 * discrete low-volume series) nothing is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ModifiedZScoreDetector.class);

    /** Scales MAD to σ for normally distributed data. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;

    /**
     * @param threshold modified z-score above which a value is anomalous; must
     *                  be &gt; 0
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ModifiedZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("modified z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public SortedSet<LocalDate> detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");
        if (series.isEmpty()) {
            return Collections.emptySortedSet();
        }

        double[] values = series.values();
        double median = Statistics.median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = Statistics.median(deviations);

        if (mad == 0) {
            LOG.trace("[{}] {}: MAD is zero; nothing flagged", AnalysisConfig.MODIFIED_ZSCORE, series.getTerm());
            return Collections.emptySortedSet();
        }

        SortedSet<LocalDate> flagged = new TreeSet<>();
        for (int i = 0; i < values.length; i++) {
            double score = CONSISTENCY_CONSTANT * (values[i] - median) / mad;
            if (Math.abs(score) > threshold) {
                flagged.add(series.dateAt(i));
            }
        }

        LOG.debug("[{}] {}: flagged {} of {} (median={} mad={})", AnalysisConfig.MODIFIED_ZSCORE,
                series.getTerm(), flagged.size(), values.length, median, mad);
        return Collections.unmodifiableSortedSet(flagged);
    }

    @Override
    public String getName() {
        return AnalysisConfig.MODIFIED_ZSCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
