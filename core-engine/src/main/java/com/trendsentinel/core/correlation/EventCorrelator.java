package com.trendsentinel.core.correlation;

import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.EventCalendar;
import com.trendsentinel.core.model.EventCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Associates high-confidence anomalies with nearby calendar events.
 *
 * <p>
 * For each event the window {@code [eventDate − windowDays, eventDate +
 * windowDays]} is inclusive on both ends. Events are reported in calendar
 * order, and only when at least one anomaly falls inside their window.
 * </p>
 *
 * @since 1.0.0
 */
public class EventCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(EventCorrelator.class);

    private final EventCalendar calendar;
    private final int windowDays;

    /**
     * @param calendar   events to match against; must not be {@code null}
     * @param windowDays half-width of the matching window in days; must be
     *                   &gt;= 0
     * @throws IllegalArgumentException if {@code windowDays} is negative
     */
    public EventCorrelator(EventCalendar calendar, int windowDays) {
        this.calendar = Objects.requireNonNull(calendar, "EventCalendar must not be null");
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must be >= 0, got: " + windowDays);
        }
        this.windowDays = windowDays;
    }

    /**
     * @param anomalies high-confidence anomalies of all terms
     * @return correlations in chronological event order
     */
    public List<EventCorrelation> correlate(Collection<AnomalyRecord> anomalies) {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");
        if (anomalies.isEmpty() || calendar.isEmpty()) {
            return Collections.emptyList();
        }

        List<EventCorrelation> correlations = new ArrayList<>();
        for (Map.Entry<LocalDate, String> event : calendar.events().entrySet()) {
            LocalDate windowStart = event.getKey().minusDays(windowDays);
            LocalDate windowEnd = event.getKey().plusDays(windowDays);

            int count = 0;
            SortedSet<String> terms = new TreeSet<>();
            for (AnomalyRecord anomaly : anomalies) {
                LocalDate date = anomaly.getDate();
                if (!date.isBefore(windowStart) && !date.isAfter(windowEnd)) {
                    count++;
                    terms.add(anomaly.getTerm());
                }
            }

            if (count > 0) {
                LOG.debug("Event '{}' ({}): {} anomaly(ies) across {}", event.getValue(), event.getKey(),
                        count, terms);
                correlations.add(new EventCorrelation(event.getValue(), event.getKey(), count, terms));
            }
        }
        return Collections.unmodifiableList(correlations);
    }

    public int getWindowDays() {
        return windowDays;
    }
}
