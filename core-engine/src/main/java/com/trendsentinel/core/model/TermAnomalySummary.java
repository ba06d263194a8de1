package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * High-confidence anomalies of one term, as they appear in the report.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "total_anomalies", "dates", "anomalies", "detector_counts" })
public final class TermAnomalySummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String term;
    private final List<AnomalyRecord> anomalies;
    private final Map<String, Integer> detectorCounts;

    /**
     * @param term           the analysed term
     * @param anomalies      high-confidence anomalies in chronological order
     * @param detectorCounts number of dates each detector flagged, in detector
     *                       order
     */
    public TermAnomalySummary(String term, List<AnomalyRecord> anomalies, Map<String, Integer> detectorCounts) {
        this.term = Objects.requireNonNull(term, "term must not be null");
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
        this.detectorCounts = Collections.unmodifiableMap(new LinkedHashMap<>(detectorCounts));
    }

    @JsonIgnore
    public String getTerm() {
        return term;
    }

    @JsonProperty("total_anomalies")
    public int getTotalAnomalies() {
        return anomalies.size();
    }

    @JsonProperty("dates")
    public List<LocalDate> getDates() {
        return anomalies.stream().map(AnomalyRecord::getDate).toList();
    }

    @JsonProperty("anomalies")
    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    @JsonProperty("detector_counts")
    public Map<String, Integer> getDetectorCounts() {
        return detectorCounts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TermAnomalySummary that))
            return false;
        return term.equals(that.term)
                && anomalies.equals(that.anomalies)
                && detectorCounts.equals(that.detectorCounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, anomalies, detectorCounts);
    }

    @Override
    public String toString() {
        return "TermAnomalySummary{term='" + term + "', total=" + anomalies.size()
                + ", detectorCounts=" + detectorCounts + '}';
    }
}
