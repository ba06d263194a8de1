package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Pre-period versus during-period comparison for one term.
 *
 * <p>
 * Metrics that cannot be computed (empty window, zero baseline) are
 * {@code null}; they are written as JSON {@code null} and never as
 * {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({ "pre_period_avg", "during_period_avg", "percent_change", "peak_value", "peak_date" })
public final class BaselineShiftResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String term;
    private final Double preMean;
    private final Double duringMean;
    private final Double percentChange;
    private final Double peakValue;
    private final LocalDate peakDate;

    public BaselineShiftResult(String term, Double preMean, Double duringMean, Double percentChange,
            Double peakValue, LocalDate peakDate) {
        this.term = Objects.requireNonNull(term, "term must not be null");
        this.preMean = preMean;
        this.duringMean = duringMean;
        this.percentChange = percentChange;
        this.peakValue = peakValue;
        this.peakDate = peakDate;
    }

    @JsonIgnore
    public String getTerm() {
        return term;
    }

    @JsonProperty("pre_period_avg")
    public Double getPreMean() {
        return preMean;
    }

    @JsonProperty("during_period_avg")
    public Double getDuringMean() {
        return duringMean;
    }

    @JsonProperty("percent_change")
    public Double getPercentChange() {
        return percentChange;
    }

    @JsonProperty("peak_value")
    public Double getPeakValue() {
        return peakValue;
    }

    @JsonProperty("peak_date")
    public LocalDate getPeakDate() {
        return peakDate;
    }

    /**
     * @return the percent change, or empty when the baseline is empty or zero
     */
    public OptionalDouble percentChange() {
        return percentChange == null ? OptionalDouble.empty() : OptionalDouble.of(percentChange);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineShiftResult that))
            return false;
        return term.equals(that.term)
                && Objects.equals(preMean, that.preMean)
                && Objects.equals(duringMean, that.duringMean)
                && Objects.equals(percentChange, that.percentChange)
                && Objects.equals(peakValue, that.peakValue)
                && Objects.equals(peakDate, that.peakDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, preMean, duringMean, percentChange, peakValue, peakDate);
    }

    @Override
    public String toString() {
        return "BaselineShiftResult{" +
                "term='" + term + '\'' +
                ", preMean=" + preMean +
                ", duringMean=" + duringMean +
                ", percentChange=" + percentChange +
                ", peakValue=" + peakValue +
                ", peakDate=" + peakDate +
                '}';
    }
}
