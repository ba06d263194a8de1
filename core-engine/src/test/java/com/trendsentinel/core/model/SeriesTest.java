package com.trendsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Series} and {@link SeriesDataset}.
 */
class SeriesTest {

    private static final LocalDate START = LocalDate.of(2020, 2, 27);

    @Test
    @DisplayName("daily() should assign consecutive dates")
    void shouldBuildDailySeries() {
        Series series = Series.daily("depression", START, 1, 2, 3);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.dates()).containsExactly(START, START.plusDays(1), START.plusDays(2));
        assertThat(series.valueOn(START.plusDays(2))).contains(3.0);
        assertThat(series.valueOn(START.minusDays(1))).isEmpty();
    }

    @Test
    @DisplayName("slice() should include both bounds and support open ends")
    void shouldSliceInclusively() {
        Series series = Series.daily("depression", START, 1, 2, 3, 4, 5);

        assertThat(series.slice(START.plusDays(1), START.plusDays(3)).values()).containsExactly(2, 3, 4);
        assertThat(series.slice(START.plusDays(3), null).values()).containsExactly(4, 5);
        assertThat(series.slice(null, START).values()).containsExactly(1);
        assertThat(series.slice(START.plusDays(10), null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("values() should return a defensive copy")
    void shouldCopyValues() {
        Series series = Series.daily("depression", START, 1, 2);
        series.values()[0] = 99;

        assertThat(series.valueAt(0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject duplicate or out-of-order dates")
    void shouldRejectUnorderedDates() {
        assertThatThrownBy(() -> Series.builder("x").add(START, 1).add(START, 2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
        assertThatThrownBy(() -> Series.builder("x").add(START, 1).add(START.minusDays(1), 2).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject negative and non-finite values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> Series.daily("x", START, 1, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
        assertThatThrownBy(() -> Series.daily("x", START, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Dataset should look up series by term and reject duplicates")
    void shouldIndexDatasetByTerm() {
        SeriesDataset dataset = SeriesDataset.of(
                Series.daily("depression", START, 1),
                Series.daily("anxiety", START, 2));

        assertThat(dataset.terms()).containsExactly("depression", "anxiety");
        assertThat(dataset.find("anxiety")).isPresent();
        assertThat(dataset.find("stress")).isEmpty();
        assertThatThrownBy(() -> SeriesDataset.of(
                Series.daily("depression", START, 1),
                Series.daily("depression", START, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }
}
