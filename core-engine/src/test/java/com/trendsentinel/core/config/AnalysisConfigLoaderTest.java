package com.trendsentinel.core.config;

import com.trendsentinel.core.model.EventCalendar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load and overlay settings from a classpath YAML file")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getDetectors()).containsExactly("zscore", "modified_zscore", "rolling_zscore");
        assertThat(config.getZScoreThreshold()).isEqualTo(3.0);
        assertThat(config.getRollingWindow()).isEqualTo(8);
        assertThat(config.getQuorum()).isEqualTo(2);
        assertThat(config.getBaselineStart()).isEqualTo(LocalDate.of(2019, 6, 1));
        assertThat(config.getBaselineCutoff()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(config.getCorrelationWindowDays()).isEqualTo(7);
        // untouched keys keep their defaults
        assertThat(config.getModifiedZScoreThreshold()).isEqualTo(3.5);
        assertThat(config.getContamination()).isEqualTo(0.05);
    }

    @Test
    @DisplayName("Should sort configured events chronologically")
    void shouldSortEvents() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getEventCalendar().events().keySet())
                .containsExactly(LocalDate.of(2020, 1, 15), LocalDate.of(2020, 2, 1));
        assertThat(config.getEventCalendar().events().firstEntry().getValue()).isEqualTo("Test event B");
    }

    @Test
    @DisplayName("The bundled analysis.yml should match the built-in defaults")
    void shouldShipDefaults() {
        assertThat(AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE))
                .isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    @DisplayName("load() falls back to the bundled resource when the environment path is unset")
    void shouldFallBackToClasspathWithoutEnvironmentPath() {
        assumeTrue(System.getenv(AnalysisConfigLoader.ENV_CONFIG_PATH) == null);

        assertThat(AnalysisConfigLoader.load()).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    @DisplayName("Should report every invalid value in the file")
    void shouldRejectInvalidFile() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors())
                        .hasSize(3)
                        .anySatisfy(msg -> assertThat(msg).contains("zScoreThreshold"))
                        .anySatisfy(msg -> assertThat(msg).contains("quorum"))
                        .anySatisfy(msg -> assertThat(msg).contains("baselineStart")));
    }

    @Test
    @DisplayName("Should throw for a missing classpath resource")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw for a missing file")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("analysis.yml");
        Files.writeString(file, "quorum: 1\nparallelism: 4\n", StandardCharsets.UTF_8);

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getQuorum()).isEqualTo(1);
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getEventCalendar()).isEqualTo(EventCalendar.defaultCalendar());
    }

    @Test
    @DisplayName("An explicit empty events list clears the calendar")
    void shouldClearCalendarForEmptyEvents(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("no-events.yml");
        Files.writeString(file, "events: []\n", StandardCharsets.UTF_8);

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getEventCalendar().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("An empty file yields the defaults")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "", StandardCharsets.UTF_8);

        assertThat(AnalysisConfigLoader.fromFile(file.toString())).isEqualTo(AnalysisConfig.defaults());
    }

    @Test
    @DisplayName("Should reject malformed dates and duplicate keys")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path badDate = dir.resolve("bad-date.yml");
        Files.writeString(badDate, "baselineCutoff: \"March 2020\"\n", StandardCharsets.UTF_8);
        Path duplicate = dir.resolve("duplicate.yml");
        Files.writeString(duplicate, "quorum: 2\nquorum: 3\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(badDate.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ISO date");
        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(duplicate.toString()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Malformed");
    }
}
