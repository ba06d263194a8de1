package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from an
 * {@link AnalysisConfig}.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * register the new type string here and in
 * {@link AnalysisConfig#SUPPORTED_DETECTORS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector of the given type, parameterised from {@code config}.
     *
     * @param type   detector type name; must not be {@code null}
     * @param config source of thresholds and seeds; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws IllegalArgumentException if the type is unknown
     */
    public static AnomalyDetector create(String type, AnalysisConfig config) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(config, "AnalysisConfig must not be null");

        return switch (type.toLowerCase(Locale.ROOT)) {
            case AnalysisConfig.ZSCORE -> new ZScoreDetector(config.getZScoreThreshold());
            case AnalysisConfig.MODIFIED_ZSCORE -> new ModifiedZScoreDetector(config.getModifiedZScoreThreshold());
            case AnalysisConfig.ENSEMBLE -> new EnsembleOutlierDetector(
                    new RandomCutForestScorer(config.getEnsembleTrees(), config.getEnsembleSampleSize(),
                            config.getRandomSeed()),
                    config.getContamination());
            case AnalysisConfig.ROLLING_ZSCORE -> new RollingZScoreDetector(config.getRollingWindow(),
                    config.getRollingThreshold());
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + type
                            + "'. Supported types: " + String.join(", ", AnalysisConfig.SUPPORTED_DETECTORS));
        };
    }

    /**
     * Create every detector listed in {@code config}, in configuration order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param config analysis configuration; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        LOG.info("Creating {} detector(s): {}", config.getDetectors().size(), config.getDetectors());
        List<AnomalyDetector> detectors = config.getDetectors().stream()
                .map(type -> create(type, config))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
