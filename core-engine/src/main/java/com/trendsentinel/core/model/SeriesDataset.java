package com.trendsentinel.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tabular input handed over by the preprocessing layer: one {@link Series} per
 * term.
 *
 * @since 1.0.0
 */
public final class SeriesDataset {

    private final Map<String, Series> seriesByTerm;

    private SeriesDataset(Map<String, Series> seriesByTerm) {
        this.seriesByTerm = Collections.unmodifiableMap(seriesByTerm);
    }

    /**
     * Index the given series by their terms.
     *
     * @param series series to include; terms must be unique
     * @return the dataset
     * @throws IllegalArgumentException if two series share a term
     */
    public static SeriesDataset of(Collection<Series> series) {
        Objects.requireNonNull(series, "Series collection must not be null");
        Map<String, Series> byTerm = new LinkedHashMap<>();
        for (Series s : series) {
            Objects.requireNonNull(s, "Series must not be null");
            if (byTerm.putIfAbsent(s.getTerm(), s) != null) {
                throw new IllegalArgumentException("Duplicate series for term '" + s.getTerm() + "'");
            }
        }
        return new SeriesDataset(byTerm);
    }

    public static SeriesDataset of(Series... series) {
        return of(Arrays.asList(series));
    }

    /**
     * @param term the series key
     * @return the series for {@code term}, or empty if the dataset has none
     */
    public Optional<Series> find(String term) {
        return Optional.ofNullable(seriesByTerm.get(term));
    }

    public Set<String> terms() {
        return seriesByTerm.keySet();
    }

    public int size() {
        return seriesByTerm.size();
    }

    @Override
    public String toString() {
        return "SeriesDataset" + seriesByTerm.values();
    }
}
