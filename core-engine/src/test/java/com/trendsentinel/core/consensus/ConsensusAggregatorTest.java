package com.trendsentinel.core.consensus;

import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.detection.AnomalyDetector;
import com.trendsentinel.core.detection.DetectorFactory;
import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.ConsensusRecord;
import com.trendsentinel.core.model.Series;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConsensusAggregator}.
 */
class ConsensusAggregatorTest {

    private static final LocalDate START = LocalDate.of(2020, 3, 1);

    private Series series;
    private Map<String, SortedSet<LocalDate>> flagged;

    @BeforeEach
    void setUp() {
        series = Series.daily("depression", START, 10, 11, 12, 80, 13, 75, 12, 60, 11, 10);

        flagged = new LinkedHashMap<>();
        flagged.put("zscore", dates(3, 5));
        flagged.put("modified_zscore", dates(3));
        flagged.put("ensemble", dates(3, 5, 7));
        flagged.put("rolling_zscore", dates(5));
    }

    @Test
    @DisplayName("Should count agreeing detectors per date")
    void shouldCountAgreement() {
        ConsensusResult result = new ConsensusAggregator(3).aggregate(series, flagged);

        assertThat(result.getRecords()).containsExactly(
                new ConsensusRecord(day(3), "depression", 3),
                new ConsensusRecord(day(5), "depression", 3),
                new ConsensusRecord(day(7), "depression", 1));
    }

    @Test
    @DisplayName("Should keep only dates that reach the quorum")
    void shouldApplyQuorum() {
        ConsensusResult result = new ConsensusAggregator(3).aggregate(series, flagged);

        assertThat(result.getHighConfidence()).extracting(AnomalyRecord::getDate)
                .containsExactly(day(3), day(5));
        AnomalyRecord first = result.getHighConfidence().get(0);
        assertThat(first.getValue()).isEqualTo(80.0);
        assertThat(first.getTerm()).isEqualTo("depression");
        assertThat(first.getDetectors()).containsExactly("zscore", "modified_zscore", "ensemble");
    }

    @Test
    @DisplayName("Raising the quorum never adds dates")
    void shouldBeMonotonicInQuorum() {
        for (int quorum = 1; quorum < flagged.size(); quorum++) {
            ConsensusResult lower = new ConsensusAggregator(quorum).aggregate(series, flagged);
            ConsensusResult higher = new ConsensusAggregator(quorum + 1).aggregate(series, flagged);

            assertThat(lower.getHighConfidence()).containsAll(higher.getHighConfidence());
        }
        assertThat(new ConsensusAggregator(4).aggregate(series, flagged).getHighConfidence()).isEmpty();
    }

    @Test
    @DisplayName("Should report how many dates each detector flagged")
    void shouldCountPerDetector() {
        ConsensusResult result = new ConsensusAggregator(2).aggregate(series, flagged);

        assertThat(result.detectorCounts()).containsExactly(
                Map.entry("zscore", 2),
                Map.entry("modified_zscore", 1),
                Map.entry("ensemble", 3),
                Map.entry("rolling_zscore", 1));
    }

    @Test
    @DisplayName("Should produce no records when no detector flags anything")
    void shouldHandleNoFlags() {
        flagged.replaceAll((name, dates) -> new TreeSet<>());

        ConsensusResult result = new ConsensusAggregator(1).aggregate(series, flagged);

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getHighConfidence()).isEmpty();
    }

    @Test
    @DisplayName("Should yield no anomaly for a constant series through every detector")
    void shouldYieldNothingForConstantSeries() {
        double[] values = new double[120];
        Arrays.fill(values, 42);
        Series constant = Series.daily("flat", START, values);

        Map<String, SortedSet<LocalDate>> results = new LinkedHashMap<>();
        for (AnomalyDetector detector : DetectorFactory.createAll(AnalysisConfig.defaults())) {
            results.put(detector.getName(), detector.detect(constant));
        }

        assertThat(new ConsensusAggregator(1).aggregate(constant, results).getRecords()).isEmpty();
    }

    @Test
    @DisplayName("A single clear outlier is confirmed by at least two detectors")
    void shouldConfirmClearOutlier() {
        double[] values = new double[101];
        for (int i = 0; i < values.length; i++) {
            values[i] = 40 + (i % 7);
        }
        values[50] = 200;
        Series outlier = Series.daily("stress", START, values);

        Map<String, SortedSet<LocalDate>> results = new LinkedHashMap<>();
        for (AnomalyDetector detector : DetectorFactory.createAll(AnalysisConfig.defaults())) {
            results.put(detector.getName(), detector.detect(outlier));
        }
        ConsensusResult result = new ConsensusAggregator(2).aggregate(outlier, results);

        assertThat(result.getHighConfidence()).extracting(AnomalyRecord::getDate)
                .contains(START.plusDays(50));
    }

    @Test
    @DisplayName("Should reject a quorum larger than the number of detectors")
    void shouldRejectUnreachableQuorum() {
        assertThatThrownBy(() -> new ConsensusAggregator(5).aggregate(series, flagged))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quorum");
    }

    @Test
    @DisplayName("Should reject a quorum below one")
    void shouldRejectZeroQuorum() {
        assertThatThrownBy(() -> new ConsensusAggregator(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a flagged date the series does not contain")
    void shouldRejectUnknownDate() {
        flagged.put("zscore", new TreeSet<>(Arrays.asList(START.minusDays(1))));

        assertThatThrownBy(() -> new ConsensusAggregator(1).aggregate(series, flagged))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not part of series");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static LocalDate day(int offset) {
        return START.plusDays(offset);
    }

    private static SortedSet<LocalDate> dates(int... offsets) {
        SortedSet<LocalDate> set = new TreeSet<>();
        for (int offset : offsets) {
            set.add(day(offset));
        }
        return set;
    }
}
