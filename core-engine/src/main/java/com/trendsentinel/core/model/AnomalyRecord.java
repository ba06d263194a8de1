package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One flagged observation together with the detectors that flagged it.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code date} and {@code term} are required and at
 * least one detector must be named; the record is immutable once built.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "date", "value", "detectors" })
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final String term;
    private final double value;

    /** Detector names in detector-configuration order. */
    private final List<String> detectors;

    private AnomalyRecord(Builder builder) {
        this.date = Objects.requireNonNull(builder.date, "date must not be null");
        this.term = Objects.requireNonNull(builder.term, "term must not be null");
        this.value = builder.value;
        if (builder.detectors.isEmpty()) {
            throw new IllegalArgumentException("AnomalyRecord for " + term + " on " + date
                    + " needs at least one contributing detector");
        }
        this.detectors = Collections.unmodifiableList(new ArrayList<>(builder.detectors));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static class Builder {
        private LocalDate date;
        private String term;
        private double value;
        private final List<String> detectors = new ArrayList<>();

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder detector(String detector) {
            this.detectors.add(Objects.requireNonNull(detector, "detector must not be null"));
            return this;
        }

        public Builder detectors(Collection<String> detectors) {
            detectors.forEach(this::detector);
            return this;
        }

        /**
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException     if {@code date} or {@code term} is
         *                                  {@code null}
         * @throws IllegalArgumentException if no detector was named
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("date")
    public LocalDate getDate() {
        return date;
    }

    @JsonIgnore
    public String getTerm() {
        return term;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("detectors")
    public List<String> getDetectors() {
        return detectors;
    }

    /**
     * @return number of detectors that flagged this date
     */
    @JsonIgnore
    public int agreementCount() {
        return detectors.size();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(value, that.value) == 0
                && date.equals(that.date)
                && term.equals(that.term)
                && detectors.equals(that.detectors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, term, value, detectors);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "date=" + date +
                ", term='" + term + '\'' +
                ", value=" + value +
                ", detectors=" + detectors +
                '}';
    }
}
