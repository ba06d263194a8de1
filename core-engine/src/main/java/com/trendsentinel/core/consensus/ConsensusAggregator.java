package com.trendsentinel.core.consensus;

import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.ConsensusRecord;
import com.trendsentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Merges the outputs of independent detectors into per-date agreement counts.
 *
 * <p>
 * Every date flagged by at least one detector gets a {@link ConsensusRecord}
 * whose count is the number of detectors that flagged it. A date is high
 * confidence when its count reaches the quorum. The aggregator holds no
 * state; identical inputs give identical results.
 * </p>
 *
 * @since 1.0.0
 */
public class ConsensusAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(ConsensusAggregator.class);

    private final int quorum;

    /**
     * @param quorum minimum number of agreeing detectors; must be &gt;= 1
     * @throws IllegalArgumentException if {@code quorum} is below 1
     */
    public ConsensusAggregator(int quorum) {
        if (quorum < 1) {
            throw new IllegalArgumentException("quorum must be >= 1, got: " + quorum);
        }
        this.quorum = quorum;
    }

    /**
     * Reconcile detector outputs for one series.
     *
     * @param series            the analysed series, used to look up values
     * @param flaggedByDetector flagged dates keyed by detector name; iteration
     *                          order becomes the order of detector names in each
     *                          record
     * @return the consensus for this series
     * @throws IllegalArgumentException if the quorum exceeds the number of
     *                                  detectors, or a flagged date is not in the
     *                                  series
     */
    public ConsensusResult aggregate(Series series, Map<String, SortedSet<LocalDate>> flaggedByDetector) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(flaggedByDetector, "Detector results must not be null");
        if (quorum > flaggedByDetector.size()) {
            throw new IllegalArgumentException("quorum " + quorum + " exceeds the number of detectors ("
                    + flaggedByDetector.size() + ")");
        }

        SortedSet<LocalDate> union = new TreeSet<>();
        flaggedByDetector.values().forEach(union::addAll);

        List<ConsensusRecord> records = new ArrayList<>(union.size());
        List<AnomalyRecord> anomalies = new ArrayList<>(union.size());
        List<AnomalyRecord> highConfidence = new ArrayList<>();

        for (LocalDate date : union) {
            double value = series.valueOn(date).orElseThrow(() -> new IllegalArgumentException(
                    "Flagged date " + date + " is not part of series '" + series.getTerm() + "'"));

            AnomalyRecord.Builder builder = AnomalyRecord.builder()
                    .date(date)
                    .term(series.getTerm())
                    .value(value);
            flaggedByDetector.forEach((detector, dates) -> {
                if (dates.contains(date)) {
                    builder.detector(detector);
                }
            });
            AnomalyRecord anomaly = builder.build();
            ConsensusRecord record = new ConsensusRecord(date, series.getTerm(), anomaly.agreementCount());

            records.add(record);
            anomalies.add(anomaly);
            if (record.isHighConfidence(quorum)) {
                highConfidence.add(anomaly);
            }
        }

        LOG.debug("Consensus for {}: {} candidate date(s), {} high confidence (quorum={})",
                series.getTerm(), union.size(), highConfidence.size(), quorum);
        return new ConsensusResult(series.getTerm(), quorum, flaggedByDetector, records, anomalies, highConfidence);
    }

    public int getQuorum() {
        return quorum;
    }
}
