package com.trendsentinel.core.correlation;

import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.EventCalendar;
import com.trendsentinel.core.model.EventCorrelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventCorrelator}.
 */
class EventCorrelatorTest {

    private static final LocalDate LOCKDOWN = LocalDate.of(2020, 6, 15);
    private static final LocalDate ELECTION = LocalDate.of(2020, 11, 3);

    private EventCorrelator correlator;

    @BeforeEach
    void setUp() {
        EventCalendar calendar = EventCalendar.builder()
                .event(ELECTION, "Election")
                .event(LOCKDOWN, "Lockdown")
                .build();
        correlator = new EventCorrelator(calendar, 14);
    }

    @Test
    @DisplayName("Window edges are inclusive")
    void shouldIncludeWindowEdges() {
        List<EventCorrelation> result = correlator.correlate(List.of(
                anomaly("depression", LOCKDOWN.minusDays(14)),
                anomaly("anxiety", LOCKDOWN.plusDays(14))));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getAnomalyCount()).isEqualTo(2);
        assertThat(result.get(0).getAffectedTerms()).containsExactly("anxiety", "depression");
    }

    @Test
    @DisplayName("Anomalies one day past the window are not counted")
    void shouldExcludeOutsideWindow() {
        List<EventCorrelation> result = correlator.correlate(List.of(
                anomaly("depression", LOCKDOWN.minusDays(15)),
                anomaly("anxiety", LOCKDOWN.plusDays(15))));

        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("Counts anomaly instances while listing each term once")
    void shouldCountInstances() {
        List<EventCorrelation> result = correlator.correlate(List.of(
                anomaly("depression", LOCKDOWN),
                anomaly("depression", LOCKDOWN.plusDays(1)),
                anomaly("stress", LOCKDOWN.minusDays(3))));

        EventCorrelation correlation = result.get(0);
        assertThat(correlation.getLabel()).isEqualTo("Lockdown");
        assertThat(correlation.getEventDate()).isEqualTo(LOCKDOWN);
        assertThat(correlation.getAnomalyCount()).isEqualTo(3);
        assertThat(correlation.getAffectedTerms()).containsExactly("depression", "stress");
    }

    @Test
    @DisplayName("Events are reported in chronological order")
    void shouldOrderEventsChronologically() {
        List<EventCorrelation> result = correlator.correlate(List.of(
                anomaly("anxiety", ELECTION.plusDays(2)),
                anomaly("anxiety", LOCKDOWN.minusDays(2))));

        assertThat(result).extracting(EventCorrelation::getLabel).containsExactly("Lockdown", "Election");
    }

    @Test
    @DisplayName("A zero-day window matches only the event date itself")
    void shouldSupportZeroWindow() {
        EventCorrelator exact = new EventCorrelator(EventCalendar.builder().event(LOCKDOWN, "Lockdown").build(), 0);

        assertThat(exact.correlate(List.of(anomaly("a", LOCKDOWN.plusDays(1))))).isEmpty();
        assertThat(exact.correlate(List.of(anomaly("a", LOCKDOWN)))).hasSize(1);
    }

    @Test
    @DisplayName("No anomalies yields no correlations")
    void shouldHandleNoAnomalies() {
        assertThat(correlator.correlate(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a negative window")
    void shouldRejectNegativeWindow() {
        assertThatThrownBy(() -> new EventCorrelator(EventCalendar.defaultCalendar(), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowDays");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyRecord anomaly(String term, LocalDate date) {
        return AnomalyRecord.builder()
                .term(term)
                .date(date)
                .value(90)
                .detector("zscore")
                .detector("ensemble")
                .build();
    }
}
