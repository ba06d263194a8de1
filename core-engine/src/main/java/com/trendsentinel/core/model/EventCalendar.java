package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, chronologically ordered mapping from calendar date to a
 * human-readable event label.
 *
 * @since 1.0.0
 */
public final class EventCalendar implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final EventCalendar DEFAULT = builder()
            .event(LocalDate.of(2020, 3, 11), "WHO declares COVID-19 pandemic")
            .event(LocalDate.of(2020, 3, 15), "US lockdowns begin")
            .event(LocalDate.of(2020, 11, 3), "US election")
            .event(LocalDate.of(2021, 1, 6), "US Capitol attack")
            .event(LocalDate.of(2022, 2, 24), "Ukraine war begins")
            .event(LocalDate.of(2023, 3, 10), "Silicon Valley Bank collapse")
            .event(LocalDate.of(2024, 1, 1), "New year mental health awareness")
            .build();

    private final NavigableMap<LocalDate, String> events;

    private EventCalendar(NavigableMap<LocalDate, String> events) {
        this.events = Collections.unmodifiableNavigableMap(events);
    }

    /**
     * @return the built-in historical calendar (pandemic declaration, lockdown
     *         onset, elections and similar)
     */
    public static EventCalendar defaultCalendar() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable view of all events in chronological order
     */
    public NavigableMap<LocalDate, String> events() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Fluent builder. Registering two events on the same date is rejected.
     */
    public static class Builder {
        private final TreeMap<LocalDate, String> events = new TreeMap<>();

        public Builder event(LocalDate date, String label) {
            Objects.requireNonNull(date, "Event date must not be null");
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("Event on " + date + " requires a label");
            }
            if (events.putIfAbsent(date, label) != null) {
                throw new IllegalArgumentException("Duplicate event date: " + date);
            }
            return this;
        }

        public Builder events(Map<LocalDate, String> all) {
            all.forEach(this::event);
            return this;
        }

        public EventCalendar build() {
            return new EventCalendar(new TreeMap<>(events));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventCalendar that))
            return false;
        return events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return "EventCalendar" + events;
    }
}
