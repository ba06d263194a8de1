package com.trendsentinel.core.config;

import com.trendsentinel.core.model.EventCalendar;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * detectors: [zscore, modified_zscore, ensemble, rolling_zscore]
 * zscoreThreshold: 2.5
 * quorum: 3
 * baselineStart: "2019-01-01"
 * baselineCutoff: "2020-03-01"
 * correlationWindowDays: 14
 * events:
 *   - date: "2020-03-11"
 *     label: WHO declares COVID-19 pandemic
 * </pre>
 *
 * <p>
 * Keys left out keep the {@link AnalysisConfig} defaults. An {@code events}
 * list replaces the default calendar; {@code events: []} disables event
 * correlation. Call
 * {@link #toConfig()} to obtain a validated configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisSettings {

    private List<String> detectors;
    private Double zscoreThreshold;
    private Double modifiedZscoreThreshold;
    private Double contamination;
    private Long randomSeed;
    private Integer ensembleTrees;
    private Integer ensembleSampleSize;
    private Integer rollingWindow;
    private Double rollingThreshold;
    private Integer quorum;
    private String baselineStart;
    private String baselineCutoff;
    private Integer correlationWindowDays;
    private Integer parallelism;
    private List<EventDefinition> events;

    /**
     * Overlay these settings on the defaults and validate the result.
     *
     * @return a validated configuration
     * @throws ConfigurationException if a value is malformed or out of range
     */
    public AnalysisConfig toConfig() {
        AnalysisConfig.Builder builder = AnalysisConfig.builder();
        List<String> errors = new ArrayList<>();

        if (detectors != null) {
            builder.detectors(detectors);
        }
        if (zscoreThreshold != null) {
            builder.zScoreThreshold(zscoreThreshold);
        }
        if (modifiedZscoreThreshold != null) {
            builder.modifiedZScoreThreshold(modifiedZscoreThreshold);
        }
        if (contamination != null) {
            builder.contamination(contamination);
        }
        if (randomSeed != null) {
            builder.randomSeed(randomSeed);
        }
        if (ensembleTrees != null) {
            builder.ensembleTrees(ensembleTrees);
        }
        if (ensembleSampleSize != null) {
            builder.ensembleSampleSize(ensembleSampleSize);
        }
        if (rollingWindow != null) {
            builder.rollingWindow(rollingWindow);
        }
        if (rollingThreshold != null) {
            builder.rollingThreshold(rollingThreshold);
        }
        if (quorum != null) {
            builder.quorum(quorum);
        }
        if (baselineStart != null) {
            builder.baselineStart(parseDate("baselineStart", baselineStart, errors));
        }
        if (baselineCutoff != null) {
            builder.baselineCutoff(parseDate("baselineCutoff", baselineCutoff, errors));
        }
        if (correlationWindowDays != null) {
            builder.correlationWindowDays(correlationWindowDays);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (events != null) {
            builder.eventCalendar(buildCalendar(errors));
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return builder.build();
    }

    private EventCalendar buildCalendar(List<String> errors) {
        EventCalendar.Builder calendar = EventCalendar.builder();
        for (int i = 0; i < events.size(); i++) {
            EventDefinition event = events.get(i);
            if (event == null) {
                errors.add("Event at index " + i + " is null");
                continue;
            }
            LocalDate date = parseDate("events[" + i + "].date", event.getDate(), errors);
            if (date == null) {
                continue;
            }
            try {
                calendar.event(date, event.getLabel());
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return calendar.build();
    }

    private static LocalDate parseDate(String name, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(name + " is required");
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            errors.add(name + " must be an ISO date (yyyy-MM-dd), got: '" + value + "'");
            return null;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public List<String> getDetectors() {
        return detectors;
    }

    public void setDetectors(List<String> detectors) {
        this.detectors = detectors;
    }

    public Double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(Double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public Double getModifiedZscoreThreshold() {
        return modifiedZscoreThreshold;
    }

    public void setModifiedZscoreThreshold(Double modifiedZscoreThreshold) {
        this.modifiedZscoreThreshold = modifiedZscoreThreshold;
    }

    public Double getContamination() {
        return contamination;
    }

    public void setContamination(Double contamination) {
        this.contamination = contamination;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public Integer getEnsembleTrees() {
        return ensembleTrees;
    }

    public void setEnsembleTrees(Integer ensembleTrees) {
        this.ensembleTrees = ensembleTrees;
    }

    public Integer getEnsembleSampleSize() {
        return ensembleSampleSize;
    }

    public void setEnsembleSampleSize(Integer ensembleSampleSize) {
        this.ensembleSampleSize = ensembleSampleSize;
    }

    public Integer getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(Integer rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public Double getRollingThreshold() {
        return rollingThreshold;
    }

    public void setRollingThreshold(Double rollingThreshold) {
        this.rollingThreshold = rollingThreshold;
    }

    public Integer getQuorum() {
        return quorum;
    }

    public void setQuorum(Integer quorum) {
        this.quorum = quorum;
    }

    public String getBaselineStart() {
        return baselineStart;
    }

    public void setBaselineStart(String baselineStart) {
        this.baselineStart = baselineStart;
    }

    public String getBaselineCutoff() {
        return baselineCutoff;
    }

    public void setBaselineCutoff(String baselineCutoff) {
        this.baselineCutoff = baselineCutoff;
    }

    public Integer getCorrelationWindowDays() {
        return correlationWindowDays;
    }

    public void setCorrelationWindowDays(Integer correlationWindowDays) {
        this.correlationWindowDays = correlationWindowDays;
    }

    public Integer getParallelism() {
        return parallelism;
    }

    public void setParallelism(Integer parallelism) {
        this.parallelism = parallelism;
    }

    public List<EventDefinition> getEvents() {
        return events;
    }

    public void setEvents(List<EventDefinition> events) {
        this.events = events != null ? new ArrayList<>(events) : null;
    }

    @Override
    public String toString() {
        return "AnalysisSettings{" +
                "detectors=" + detectors +
                ", zscoreThreshold=" + zscoreThreshold +
                ", modifiedZscoreThreshold=" + modifiedZscoreThreshold +
                ", contamination=" + contamination +
                ", quorum=" + quorum +
                ", baselineStart='" + baselineStart + '\'' +
                ", baselineCutoff='" + baselineCutoff + '\'' +
                ", events=" + events.size() +
                '}';
    }
}
