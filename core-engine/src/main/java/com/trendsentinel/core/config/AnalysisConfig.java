package com.trendsentinel.core.config;

import com.trendsentinel.core.model.EventCalendar;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration for one report run.
 *
 * <p>
 * Holds every detector threshold, the consensus quorum, the baseline
 * windows, the event calendar and the correlation window. Nothing here is
 * process-wide state; each {@code ReportAssembler} receives its own
 * instance.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}. The builder validates all
 * values at {@link Builder#build()} time and reports every problem at once
 * through {@link ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ZSCORE = "zscore";
    public static final String MODIFIED_ZSCORE = "modified_zscore";
    public static final String ENSEMBLE = "ensemble";
    public static final String ROLLING_ZSCORE = "rolling_zscore";

    /** Detector types in their default evaluation order. */
    public static final List<String> SUPPORTED_DETECTORS = List.of(ZSCORE, MODIFIED_ZSCORE, ENSEMBLE, ROLLING_ZSCORE);

    // ---------------------------------------------------------------
    // Detectors
    // ---------------------------------------------------------------
    private final List<String> detectors;
    private final double zScoreThreshold;
    private final double modifiedZScoreThreshold;
    private final double contamination;
    private final long randomSeed;
    private final int ensembleTrees;
    private final int ensembleSampleSize;
    private final int rollingWindow;
    private final double rollingThreshold;

    // ---------------------------------------------------------------
    // Consensus
    // ---------------------------------------------------------------
    private final int quorum;

    // ---------------------------------------------------------------
    // Baseline shift
    // ---------------------------------------------------------------
    private final LocalDate baselineStart;
    private final LocalDate baselineCutoff;

    // ---------------------------------------------------------------
    // Event correlation
    // ---------------------------------------------------------------
    private final EventCalendar eventCalendar;
    private final int correlationWindowDays;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int parallelism;

    private AnalysisConfig(Builder b) {
        this.detectors = List.copyOf(b.detectors);
        this.zScoreThreshold = b.zScoreThreshold;
        this.modifiedZScoreThreshold = b.modifiedZScoreThreshold;
        this.contamination = b.contamination;
        this.randomSeed = b.randomSeed;
        this.ensembleTrees = b.ensembleTrees;
        this.ensembleSampleSize = b.ensembleSampleSize;
        this.rollingWindow = b.rollingWindow;
        this.rollingThreshold = b.rollingThreshold;
        this.quorum = b.quorum;
        this.baselineStart = b.baselineStart;
        this.baselineCutoff = b.baselineCutoff;
        this.eventCalendar = b.eventCalendar;
        this.correlationWindowDays = b.correlationWindowDays;
        this.parallelism = b.parallelism;
    }

    /**
     * @return configuration with every default applied
     */
    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .detectors(detectors)
                .zScoreThreshold(zScoreThreshold)
                .modifiedZScoreThreshold(modifiedZScoreThreshold)
                .contamination(contamination)
                .randomSeed(randomSeed)
                .ensembleTrees(ensembleTrees)
                .ensembleSampleSize(ensembleSampleSize)
                .rollingWindow(rollingWindow)
                .rollingThreshold(rollingThreshold)
                .quorum(quorum)
                .baselineStart(baselineStart)
                .baselineCutoff(baselineCutoff)
                .eventCalendar(eventCalendar)
                .correlationWindowDays(correlationWindowDays)
                .parallelism(parallelism);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public List<String> getDetectors() {
        return detectors;
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public double getModifiedZScoreThreshold() {
        return modifiedZScoreThreshold;
    }

    public double getContamination() {
        return contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public int getEnsembleTrees() {
        return ensembleTrees;
    }

    public int getEnsembleSampleSize() {
        return ensembleSampleSize;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    public double getRollingThreshold() {
        return rollingThreshold;
    }

    public int getQuorum() {
        return quorum;
    }

    public LocalDate getBaselineStart() {
        return baselineStart;
    }

    public LocalDate getBaselineCutoff() {
        return baselineCutoff;
    }

    public EventCalendar getEventCalendar() {
        return eventCalendar;
    }

    public int getCorrelationWindowDays() {
        return correlationWindowDays;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnalysisConfig}.
     *
     * <p>
     * {@link #build()} checks: thresholds &gt; 0, contamination in (0, 0.5),
     * rolling window &gt;= 2, a non-empty list of known, distinct detectors,
     * quorum in [1, detector count], baseline start before cutoff,
     * correlation window &gt;= 0, parallelism &gt;= 1, ensemble trees and
     * sample size &gt; 0.
     * </p>
     */
    public static class Builder {
        private List<String> detectors = SUPPORTED_DETECTORS;
        private double zScoreThreshold = 2.5;
        private double modifiedZScoreThreshold = 3.5;
        private double contamination = 0.05;
        private long randomSeed = 42L;
        private int ensembleTrees = 100;
        private int ensembleSampleSize = 256;
        private int rollingWindow = 12;
        private double rollingThreshold = 2.5;
        private int quorum = 3;
        private LocalDate baselineStart = LocalDate.of(2019, 1, 1);
        private LocalDate baselineCutoff = LocalDate.of(2020, 3, 1);
        private EventCalendar eventCalendar = EventCalendar.defaultCalendar();
        private int correlationWindowDays = 14;
        private int parallelism = 1;

        public Builder detectors(List<String> v) {
            this.detectors = v;
            return this;
        }

        public Builder zScoreThreshold(double v) {
            this.zScoreThreshold = v;
            return this;
        }

        public Builder modifiedZScoreThreshold(double v) {
            this.modifiedZScoreThreshold = v;
            return this;
        }

        public Builder contamination(double v) {
            this.contamination = v;
            return this;
        }

        public Builder randomSeed(long v) {
            this.randomSeed = v;
            return this;
        }

        public Builder ensembleTrees(int v) {
            this.ensembleTrees = v;
            return this;
        }

        public Builder ensembleSampleSize(int v) {
            this.ensembleSampleSize = v;
            return this;
        }

        public Builder rollingWindow(int v) {
            this.rollingWindow = v;
            return this;
        }

        public Builder rollingThreshold(double v) {
            this.rollingThreshold = v;
            return this;
        }

        public Builder quorum(int v) {
            this.quorum = v;
            return this;
        }

        public Builder baselineStart(LocalDate v) {
            this.baselineStart = v;
            return this;
        }

        public Builder baselineCutoff(LocalDate v) {
            this.baselineCutoff = v;
            return this;
        }

        public Builder eventCalendar(EventCalendar v) {
            this.eventCalendar = v;
            return this;
        }

        public Builder correlationWindowDays(int v) {
            this.correlationWindowDays = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AnalysisConfig}
         * @throws ConfigurationException if any value is invalid
         */
        public AnalysisConfig build() {
            List<String> errors = new ArrayList<>();

            validateDetectors(errors);
            requirePositive(zScoreThreshold, "zScoreThreshold", errors);
            requirePositive(modifiedZScoreThreshold, "modifiedZScoreThreshold", errors);
            requirePositive(rollingThreshold, "rollingThreshold", errors);

            if (!(contamination > 0 && contamination < 0.5)) {
                errors.add("contamination must be in (0, 0.5), got: " + contamination);
            }
            if (ensembleTrees < 1) {
                errors.add("ensembleTrees must be >= 1, got: " + ensembleTrees);
            }
            if (ensembleSampleSize < 1) {
                errors.add("ensembleSampleSize must be >= 1, got: " + ensembleSampleSize);
            }
            if (rollingWindow < 2) {
                errors.add("rollingWindow must be >= 2, got: " + rollingWindow);
            }
            if (baselineStart == null || baselineCutoff == null) {
                errors.add("baselineStart and baselineCutoff are required");
            } else if (!baselineStart.isBefore(baselineCutoff)) {
                errors.add("baselineStart (" + baselineStart + ") must be before baselineCutoff ("
                        + baselineCutoff + ")");
            }
            if (eventCalendar == null) {
                errors.add("eventCalendar is required");
            }
            if (correlationWindowDays < 0) {
                errors.add("correlationWindowDays must be >= 0, got: " + correlationWindowDays);
            }
            if (parallelism < 1) {
                errors.add("parallelism must be >= 1, got: " + parallelism);
            }

            if (!errors.isEmpty()) {
                throw new ConfigurationException(errors);
            }
            return new AnalysisConfig(this);
        }

        private void validateDetectors(List<String> errors) {
            if (detectors == null || detectors.isEmpty()) {
                errors.add("at least one detector is required");
                return;
            }
            Set<String> seen = new HashSet<>();
            for (String detector : detectors) {
                if (detector == null || !SUPPORTED_DETECTORS.contains(detector)) {
                    errors.add("Unknown detector: '" + detector + "'. Supported: "
                            + String.join(", ", SUPPORTED_DETECTORS));
                } else if (!seen.add(detector)) {
                    errors.add("Detector listed twice: '" + detector + "'");
                }
            }
            if (quorum < 1 || quorum > detectors.size()) {
                errors.add("quorum must be in [1, " + detectors.size() + "], got: " + quorum);
            }
        }

        private static void requirePositive(double value, String name, List<String> errors) {
            if (!(value > 0) || Double.isInfinite(value)) {
                errors.add(name + " must be a finite value > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisConfig that))
            return false;
        return Double.compare(zScoreThreshold, that.zScoreThreshold) == 0
                && Double.compare(modifiedZScoreThreshold, that.modifiedZScoreThreshold) == 0
                && Double.compare(contamination, that.contamination) == 0
                && randomSeed == that.randomSeed
                && ensembleTrees == that.ensembleTrees
                && ensembleSampleSize == that.ensembleSampleSize
                && rollingWindow == that.rollingWindow
                && Double.compare(rollingThreshold, that.rollingThreshold) == 0
                && quorum == that.quorum
                && correlationWindowDays == that.correlationWindowDays
                && parallelism == that.parallelism
                && detectors.equals(that.detectors)
                && baselineStart.equals(that.baselineStart)
                && baselineCutoff.equals(that.baselineCutoff)
                && eventCalendar.equals(that.eventCalendar);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectors, zScoreThreshold, modifiedZScoreThreshold, contamination, randomSeed,
                ensembleTrees, ensembleSampleSize, rollingWindow, rollingThreshold, quorum, baselineStart,
                baselineCutoff, eventCalendar, correlationWindowDays, parallelism);
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "detectors=" + detectors +
                ", zScoreThreshold=" + zScoreThreshold +
                ", modifiedZScoreThreshold=" + modifiedZScoreThreshold +
                ", contamination=" + contamination +
                ", randomSeed=" + randomSeed +
                ", ensembleTrees=" + ensembleTrees +
                ", ensembleSampleSize=" + ensembleSampleSize +
                ", rollingWindow=" + rollingWindow +
                ", rollingThreshold=" + rollingThreshold +
                ", quorum=" + quorum +
                ", baselineStart=" + baselineStart +
                ", baselineCutoff=" + baselineCutoff +
                ", events=" + eventCalendar.size() +
                ", correlationWindowDays=" + correlationWindowDays +
                ", parallelism=" + parallelism +
                '}';
    }
}
