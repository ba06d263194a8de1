package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root aggregate produced by one report run.
 *
 * <p>
 * Immutable once built. Per-term maps keep the order in which terms were
 * requested so that serialized output is stable.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code generatedAt} is required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "analysis_date", "terms_analyzed", "anomalies_by_term", "baseline_shift",
        "event_correlations", "omitted_terms" })
public final class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant generatedAt;
    private final List<String> termsAnalyzed;
    private final Map<String, TermAnomalySummary> anomaliesByTerm;
    private final Map<String, BaselineShiftResult> baselineShifts;
    private final List<EventCorrelation> eventCorrelations;
    private final List<TermOmission> omissions;

    private AnomalyReport(Builder builder) {
        this.generatedAt = Objects.requireNonNull(builder.generatedAt, "generatedAt must not be null");
        this.termsAnalyzed = Collections.unmodifiableList(new ArrayList<>(builder.termsAnalyzed));
        this.anomaliesByTerm = Collections.unmodifiableMap(new LinkedHashMap<>(builder.anomaliesByTerm));
        this.baselineShifts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.baselineShifts));
        this.eventCorrelations = Collections.unmodifiableList(new ArrayList<>(builder.eventCorrelations));
        this.omissions = Collections.unmodifiableList(new ArrayList<>(builder.omissions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates per-term results during assembly.
     */
    public static class Builder {
        private Instant generatedAt;
        private final List<String> termsAnalyzed = new ArrayList<>();
        private final Map<String, TermAnomalySummary> anomaliesByTerm = new LinkedHashMap<>();
        private final Map<String, BaselineShiftResult> baselineShifts = new LinkedHashMap<>();
        private final List<EventCorrelation> eventCorrelations = new ArrayList<>();
        private final List<TermOmission> omissions = new ArrayList<>();

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Builder termsAnalyzed(List<String> terms) {
            this.termsAnalyzed.addAll(terms);
            return this;
        }

        public Builder anomalies(TermAnomalySummary summary) {
            this.anomaliesByTerm.put(summary.getTerm(), summary);
            return this;
        }

        public Builder baselineShift(BaselineShiftResult result) {
            this.baselineShifts.put(result.getTerm(), result);
            return this;
        }

        public Builder eventCorrelations(List<EventCorrelation> correlations) {
            this.eventCorrelations.addAll(correlations);
            return this;
        }

        public Builder omission(TermOmission omission) {
            this.omissions.add(omission);
            return this;
        }

        /**
         * @return a new {@link AnomalyReport}
         * @throws NullPointerException if {@code generatedAt} is {@code null}
         */
        public AnomalyReport build() {
            return new AnomalyReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("analysis_date")
    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("terms_analyzed")
    public List<String> getTermsAnalyzed() {
        return termsAnalyzed;
    }

    @JsonProperty("anomalies_by_term")
    public Map<String, TermAnomalySummary> getAnomaliesByTerm() {
        return anomaliesByTerm;
    }

    @JsonProperty("baseline_shift")
    public Map<String, BaselineShiftResult> getBaselineShifts() {
        return baselineShifts;
    }

    @JsonProperty("event_correlations")
    public List<EventCorrelation> getEventCorrelations() {
        return eventCorrelations;
    }

    @JsonProperty("omitted_terms")
    public List<TermOmission> getOmissions() {
        return omissions;
    }

    public Optional<TermAnomalySummary> anomaliesFor(String term) {
        return Optional.ofNullable(anomaliesByTerm.get(term));
    }

    public Optional<BaselineShiftResult> baselineShiftFor(String term) {
        return Optional.ofNullable(baselineShifts.get(term));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return generatedAt.equals(that.generatedAt)
                && termsAnalyzed.equals(that.termsAnalyzed)
                && anomaliesByTerm.equals(that.anomaliesByTerm)
                && baselineShifts.equals(that.baselineShifts)
                && eventCorrelations.equals(that.eventCorrelations)
                && omissions.equals(that.omissions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(generatedAt, termsAnalyzed, anomaliesByTerm, baselineShifts, eventCorrelations,
                omissions);
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "generatedAt=" + generatedAt +
                ", termsAnalyzed=" + termsAnalyzed +
                ", anomalyTerms=" + anomaliesByTerm.keySet() +
                ", eventCorrelations=" + eventCorrelations.size() +
                ", omissions=" + omissions.size() +
                '}';
    }
}
