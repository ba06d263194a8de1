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
 * Contamination-based outlier detector.
 *
 * <p>
 * Delegates scoring to an {@link OutlierScorer}, takes the
 * {@code (1 − contamination)} percentile of the scores as the cut-off and
 * flags every point scoring strictly above it. At most roughly
 * {@code contamination × n} points are flagged; points tied at the cut-off
 * are not, so a constant series flags nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleOutlierDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleOutlierDetector.class);

    private final OutlierScorer scorer;
    private final double contamination;

    /**
     * @param scorer        scoring method; must not be {@code null}
     * @param contamination expected fraction of anomalies, in (0, 0.5)
     * @throws IllegalArgumentException if {@code contamination} is out of range
     */
    public EnsembleOutlierDetector(OutlierScorer scorer, double contamination) {
        this.scorer = Objects.requireNonNull(scorer, "OutlierScorer must not be null");
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public SortedSet<LocalDate> detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");
        if (series.size() < 2) {
            return Collections.emptySortedSet();
        }

        double[] scores = scorer.score(series.values());
        if (scores.length != series.size()) {
            throw new IllegalStateException("Scorer returned " + scores.length + " score(s) for "
                    + series.size() + " point(s)");
        }
        double cutoff = Statistics.percentile(scores, 1.0 - contamination);

        SortedSet<LocalDate> flagged = new TreeSet<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > cutoff) {
                flagged.add(series.dateAt(i));
            }
        }

        LOG.debug("[{}] {}: flagged {} of {} (cutoff={})", AnalysisConfig.ENSEMBLE, series.getTerm(),
                flagged.size(), scores.length, cutoff);
        return Collections.unmodifiableSortedSet(flagged);
    }

    @Override
    public String getName() {
        return AnalysisConfig.ENSEMBLE;
    }

    public double getContamination() {
        return contamination;
    }

    OutlierScorer getScorer() {
        return scorer;
    }
}
