package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * High-confidence anomalies found near one calendar event.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "event", "event_date", "anomaly_count", "terms_affected" })
public final class EventCorrelation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String label;
    private final LocalDate eventDate;
    private final int anomalyCount;
    private final SortedSet<String> affectedTerms;

    public EventCorrelation(String label, LocalDate eventDate, int anomalyCount, Collection<String> affectedTerms) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.eventDate = Objects.requireNonNull(eventDate, "eventDate must not be null");
        if (anomalyCount < 1) {
            throw new IllegalArgumentException("anomalyCount must be >= 1, got: " + anomalyCount);
        }
        this.anomalyCount = anomalyCount;
        this.affectedTerms = Collections.unmodifiableSortedSet(new TreeSet<>(affectedTerms));
    }

    @JsonProperty("event")
    public String getLabel() {
        return label;
    }

    @JsonProperty("event_date")
    public LocalDate getEventDate() {
        return eventDate;
    }

    /**
     * @return number of matching anomaly instances; the same date in two terms
     *         counts twice
     */
    @JsonProperty("anomaly_count")
    public int getAnomalyCount() {
        return anomalyCount;
    }

    @JsonProperty("terms_affected")
    public SortedSet<String> getAffectedTerms() {
        return affectedTerms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventCorrelation that))
            return false;
        return anomalyCount == that.anomalyCount
                && label.equals(that.label)
                && eventDate.equals(that.eventDate)
                && affectedTerms.equals(that.affectedTerms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, eventDate, anomalyCount, affectedTerms);
    }

    @Override
    public String toString() {
        return "EventCorrelation{" +
                "label='" + label + '\'' +
                ", eventDate=" + eventDate +
                ", anomalyCount=" + anomalyCount +
                ", affectedTerms=" + affectedTerms +
                '}';
    }
}
