package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Daily search-interest observations for one term.
 *
 * <p>
 * Dates are strictly increasing and values are finite and non-negative. The
 * series is expected to arrive already aligned and imputed; it is never
 * interpolated here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder(String)} or {@link #daily(String, LocalDate, double...)}.
 * Duplicate or out-of-order dates are a caller bug and are rejected with
 * {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Series implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String term;
    private final LocalDate[] dates;
    private final double[] values;

    private Series(String term, LocalDate[] dates, double[] values) {
        this.term = term;
        this.dates = dates;
        this.values = values;
    }

    /**
     * Create a new {@link Builder} for the given term.
     *
     * @param term series key; must not be {@code null}
     * @return builder instance
     */
    public static Builder builder(String term) {
        return new Builder(term);
    }

    /**
     * Build a gap-free daily series starting at {@code start}.
     *
     * @param term   series key
     * @param start  date of the first value
     * @param values one value per consecutive day
     * @return the series
     */
    public static Series daily(String term, LocalDate start, double... values) {
        Objects.requireNonNull(start, "Start date must not be null");
        Builder builder = builder(term);
        for (int i = 0; i < values.length; i++) {
            builder.add(start.plusDays(i), values[i]);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getTerm() {
        return term;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public LocalDate dateAt(int index) {
        return dates[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    /**
     * @return a copy of the observation values in chronological order
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * @return unmodifiable list of observation dates
     */
    public List<LocalDate> dates() {
        return Collections.unmodifiableList(Arrays.asList(dates));
    }

    /**
     * Look up the value observed on {@code date}.
     *
     * @param date the observation date
     * @return the value, or empty if the series has no observation on that date
     */
    public Optional<Double> valueOn(LocalDate date) {
        int index = Arrays.binarySearch(dates, date);
        return index >= 0 ? Optional.of(values[index]) : Optional.empty();
    }

    /**
     * Return the observations with {@code from <= date <= to}. Either bound may
     * be {@code null} for an open end.
     *
     * @param from inclusive lower bound, or {@code null}
     * @param to   inclusive upper bound, or {@code null}
     * @return a new, possibly empty, series for the same term
     */
    public Series slice(LocalDate from, LocalDate to) {
        int start = from == null ? 0 : lowerBound(from);
        int end = to == null ? dates.length : upperBound(to);
        if (end <= start) {
            return new Series(term, new LocalDate[0], new double[0]);
        }
        return new Series(term,
                Arrays.copyOfRange(dates, start, end),
                Arrays.copyOfRange(values, start, end));
    }

    private int lowerBound(LocalDate date) {
        int index = Arrays.binarySearch(dates, date);
        return index >= 0 ? index : -index - 1;
    }

    private int upperBound(LocalDate date) {
        int index = Arrays.binarySearch(dates, date);
        return index >= 0 ? index + 1 : -index - 1;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Accumulates observations in date order and validates them at
     * {@link #build()} time.
     */
    public static class Builder {
        private final String term;
        private final List<LocalDate> dates = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();

        private Builder(String term) {
            this.term = Objects.requireNonNull(term, "Term must not be null");
        }

        public Builder add(LocalDate date, double value) {
            dates.add(Objects.requireNonNull(date, "Observation date must not be null"));
            values.add(value);
            return this;
        }

        /**
         * Build the series.
         *
         * @return a new {@link Series}
         * @throws IllegalArgumentException if dates are duplicated or out of order,
         *                                  or a value is negative or not finite
         */
        public Series build() {
            LocalDate[] d = dates.toArray(new LocalDate[0]);
            double[] v = new double[values.size()];
            for (int i = 0; i < v.length; i++) {
                v[i] = values.get(i);
                if (!Double.isFinite(v[i]) || v[i] < 0) {
                    throw new IllegalArgumentException("Series '" + term + "' has invalid value "
                            + v[i] + " on " + d[i] + "; values must be finite and non-negative");
                }
                if (i > 0 && !d[i].isAfter(d[i - 1])) {
                    throw new IllegalArgumentException("Series '" + term + "' dates must be strictly increasing: "
                            + d[i - 1] + " followed by " + d[i]);
                }
            }
            return new Series(term, d, v);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Series that))
            return false;
        return term.equals(that.term)
                && Arrays.equals(dates, that.dates)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, Arrays.hashCode(dates), Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "Series{" +
                "term='" + term + '\'' +
                ", size=" + values.length +
                (values.length > 0 ? ", from=" + dates[0] + ", to=" + dates[dates.length - 1] : "") +
                '}';
    }
}
