package com.trendsentinel.core.consensus;

import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.ConsensusRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Outcome of reconciling all detectors for one term.
 *
 * <p>
 * {@link #getRecords()} and {@link #getAnomalies()} cover every date flagged
 * by at least one detector; {@link #getHighConfidence()} keeps the dates that
 * reached the quorum. All lists are chronological.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConsensusResult {

    private final String term;
    private final int quorum;
    private final Map<String, SortedSet<LocalDate>> flaggedByDetector;
    private final List<ConsensusRecord> records;
    private final List<AnomalyRecord> anomalies;
    private final List<AnomalyRecord> highConfidence;

    ConsensusResult(String term, int quorum, Map<String, SortedSet<LocalDate>> flaggedByDetector,
            List<ConsensusRecord> records, List<AnomalyRecord> anomalies, List<AnomalyRecord> highConfidence) {
        this.term = Objects.requireNonNull(term, "term must not be null");
        this.quorum = quorum;
        this.flaggedByDetector = Collections.unmodifiableMap(new LinkedHashMap<>(flaggedByDetector));
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
        this.highConfidence = Collections.unmodifiableList(new ArrayList<>(highConfidence));
    }

    public String getTerm() {
        return term;
    }

    public int getQuorum() {
        return quorum;
    }

    /**
     * @return each detector's flagged dates, in detector order
     */
    public Map<String, SortedSet<LocalDate>> getFlaggedByDetector() {
        return flaggedByDetector;
    }

    public List<ConsensusRecord> getRecords() {
        return records;
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public List<AnomalyRecord> getHighConfidence() {
        return highConfidence;
    }

    /**
     * @return number of dates each detector flagged, in detector order
     */
    public Map<String, Integer> detectorCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        flaggedByDetector.forEach((name, dates) -> counts.put(name, dates.size()));
        return counts;
    }

    @Override
    public String toString() {
        return "ConsensusResult{" +
                "term='" + term + '\'' +
                ", quorum=" + quorum +
                ", candidates=" + records.size() +
                ", highConfidence=" + highConfidence.size() +
                '}';
    }
}
