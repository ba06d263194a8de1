package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.Series;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private static final LocalDate START = LocalDate.of(2021, 1, 1);

    private ZScoreDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ZScoreDetector(2.5);
    }

    @Test
    @DisplayName("Should flag exactly the injected outlier")
    void shouldFlagInjectedOutlier() {
        double[] values = cyclicValues(101);
        values[50] = 200;

        assertThat(detector.detect(Series.daily("depression", START, values)))
                .containsExactly(START.plusDays(50));
    }

    @Test
    @DisplayName("Should NOT flag anything in a constant series")
    void shouldNotFlagConstantSeries() {
        double[] values = new double[60];
        Arrays.fill(values, 50);

        assertThat(detector.detect(Series.daily("depression", START, values))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT flag anything when fewer than two observations exist")
    void shouldNotFlagTinySeries() {
        assertThat(detector.detect(Series.daily("depression", START))).isEmpty();
        assertThat(detector.detect(Series.daily("depression", START, 80))).isEmpty();
    }

    @Test
    @DisplayName("Should use a strict inequality against the threshold")
    void shouldUseStrictThreshold() {
        // mean = 2, sample stddev = 2 → the last value has z = 1 exactly
        ZScoreDetector unitThreshold = new ZScoreDetector(1.0);
        Series series = Series.daily("stress", START, 0, 0, 2, 4, 4);

        assertThat(unitThreshold.detect(series)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new ZScoreDetector(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] cyclicValues(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 40 + (i % 7);
        }
        return values;
    }
}
