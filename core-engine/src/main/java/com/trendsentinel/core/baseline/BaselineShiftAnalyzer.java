package com.trendsentinel.core.baseline;

import com.trendsentinel.core.model.BaselineShiftResult;
import com.trendsentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Compares a fixed historical window against the period that follows a
 * cutoff date.
 *
 * <p>
 * The pre-period covers {@code baselineStart <= date <= cutoff}; the
 * during-period covers {@code date >= cutoff} up to the end of the series.
 * The cutoff observation, when present, belongs to both.
 * </p>
 *
 * <h3>Undefined metrics</h3>
 * <ul>
 * <li>Empty pre-period: pre mean and percent change are {@code null}.</li>
 * <li>Pre mean of zero: percent change is {@code null}.</li>
 * <li>Empty during-period: during mean, peak and percent change are
 * {@code null}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class BaselineShiftAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineShiftAnalyzer.class);

    private final LocalDate baselineStart;
    private final LocalDate cutoff;

    /**
     * @param baselineStart first day of the pre-period
     * @param cutoff        last day of the pre-period and first day of the
     *                      during-period; must be after {@code baselineStart}
     * @throws IllegalArgumentException if {@code cutoff} is not after
     *                                  {@code baselineStart}
     */
    public BaselineShiftAnalyzer(LocalDate baselineStart, LocalDate cutoff) {
        this.baselineStart = Objects.requireNonNull(baselineStart, "baselineStart must not be null");
        this.cutoff = Objects.requireNonNull(cutoff, "cutoff must not be null");
        if (!baselineStart.isBefore(cutoff)) {
            throw new IllegalArgumentException(
                    "baselineStart " + baselineStart + " must be before cutoff " + cutoff);
        }
    }

    /**
     * @param series the term's series
     * @return pre/during comparison for the term
     */
    public BaselineShiftResult analyze(Series series) {
        Objects.requireNonNull(series, "Series must not be null");

        Series pre = series.slice(baselineStart, cutoff);
        Series during = series.slice(cutoff, null);

        Double preMean = pre.isEmpty() ? null : mean(pre);
        Double duringMean = during.isEmpty() ? null : mean(during);

        Double percentChange = null;
        if (preMean != null && duringMean != null && preMean != 0) {
            percentChange = (duringMean - preMean) / preMean * 100.0;
        } else {
            LOG.trace("{}: percent change undefined (preMean={}, duringMean={})",
                    series.getTerm(), preMean, duringMean);
        }

        Double peakValue = null;
        LocalDate peakDate = null;
        for (int i = 0; i < during.size(); i++) {
            if (peakValue == null || during.valueAt(i) > peakValue) {
                peakValue = during.valueAt(i);
                peakDate = during.dateAt(i);
            }
        }

        LOG.debug("Baseline shift for {}: pre={} during={} change={}% peak={} on {}",
                series.getTerm(), preMean, duringMean, percentChange, peakValue, peakDate);
        return new BaselineShiftResult(series.getTerm(), preMean, duringMean, percentChange, peakValue, peakDate);
    }

    private static double mean(Series series) {
        double sum = 0;
        for (int i = 0; i < series.size(); i++) {
            sum += series.valueAt(i);
        }
        return sum / series.size();
    }

    public LocalDate getBaselineStart() {
        return baselineStart;
    }

    public LocalDate getCutoff() {
        return cutoff;
    }
}
