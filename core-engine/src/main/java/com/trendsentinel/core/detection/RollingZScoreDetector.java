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
 * Local z-score detector over a centered rolling window.
 *
 * <p>
 * For position {@code i} the window covers indices
 * {@code [i − w/2, i − w/2 + w − 1]}; for an even window the extra
 * observation falls before {@code i}. Mean and sample standard deviation are
 * taken over that window, and the observation is flagged when
 * {@code |v − mean| / std > threshold}. This catches spikes that are large
 * relative to their neighbourhood but small relative to a trending series as
 * a whole.
 * </p>
 *
 * <h3>Boundaries</h3>
 * <p>
 * Positions whose window would run past either end of the series have no
 * rolling statistics and are never flagged. Windows with zero standard
 * deviation are never flagged either.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RollingZScoreDetector.class);

    /** Minimum window for a sample standard deviation. */
    static final int MIN_WINDOW = 2;

    private final int window;
    private final double threshold;

    /**
     * @param window    number of observations per window; must be &gt;=
     *                  {@value #MIN_WINDOW}
     * @param threshold local z-score above which a value is anomalous; must be
     *                  &gt; 0
     * @throws IllegalArgumentException if either argument is out of range
     */
    public RollingZScoreDetector(int window, double threshold) {
        if (window < MIN_WINDOW) {
            throw new IllegalArgumentException("rolling window must be >= " + MIN_WINDOW + ", got: " + window);
        }
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("rolling threshold must be > 0, got: " + threshold);
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public SortedSet<LocalDate> detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");

        double[] values = series.values();
        int lead = window / 2;
        SortedSet<LocalDate> flagged = new TreeSet<>();

        for (int i = 0; i < values.length; i++) {
            int from = i - lead;
            int to = from + window;
            if (from < 0 || to > values.length) {
                continue;
            }
            double mean = Statistics.mean(values, from, to);
            double stddev = Statistics.sampleStdDev(values, from, to, mean);
            if (stddev == 0) {
                continue;
            }
            if (Math.abs(values[i] - mean) / stddev > threshold) {
                flagged.add(series.dateAt(i));
            }
        }

        LOG.debug("[{}] {}: flagged {} of {} (window={})", AnalysisConfig.ROLLING_ZSCORE, series.getTerm(),
                flagged.size(), values.length, window);
        return Collections.unmodifiableSortedSet(flagged);
    }

    @Override
    public String getName() {
        return AnalysisConfig.ROLLING_ZSCORE;
    }

    public int getWindow() {
        return window;
    }

    public double getThreshold() {
        return threshold;
    }
}
