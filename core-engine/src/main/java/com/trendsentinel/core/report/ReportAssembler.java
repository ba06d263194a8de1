package com.trendsentinel.core.report;

import com.trendsentinel.core.baseline.BaselineShiftAnalyzer;
import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.ConfigurationException;
import com.trendsentinel.core.consensus.ConsensusAggregator;
import com.trendsentinel.core.consensus.ConsensusResult;
import com.trendsentinel.core.correlation.EventCorrelator;
import com.trendsentinel.core.detection.AnomalyDetector;
import com.trendsentinel.core.detection.DetectorFactory;
import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.AnomalyReport;
import com.trendsentinel.core.model.BaselineShiftResult;
import com.trendsentinel.core.model.EventCorrelation;
import com.trendsentinel.core.model.Series;
import com.trendsentinel.core.model.SeriesDataset;
import com.trendsentinel.core.model.TermAnomalySummary;
import com.trendsentinel.core.model.TermOmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the full analysis for a set of terms and assembles one
 * {@link AnomalyReport}.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   for each requested term
 *     → every detector
 *     → consensus aggregation (quorum)
 *     → baseline shift
 *   after all terms (barrier)
 *     → event correlation over the union of high-confidence anomalies
 * </pre>
 *
 * <h3>Failure handling</h3>
 * <p>
 * Invalid configuration fails in the constructor, before any term is
 * touched. A term missing from the dataset, or a term whose analysis throws,
 * is recorded as a {@link TermOmission} and the remaining terms proceed.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Terms are independent. With {@code parallelism > 1} they are analysed on a
 * fixed thread pool and merged back in request order, so the report is the
 * same as the sequential one.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ReportAssembler.class);

    private final AnalysisConfig config;
    private final Clock clock;
    private final List<AnomalyDetector> detectors;
    private final ConsensusAggregator aggregator;
    private final BaselineShiftAnalyzer baselineAnalyzer;
    private final EventCorrelator correlator;

    /**
     * @param config validated analysis configuration
     */
    public ReportAssembler(AnalysisConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config validated analysis configuration
     * @param clock  source of the report generation timestamp
     */
    public ReportAssembler(AnalysisConfig config, Clock clock) {
        this(config, clock, DetectorFactory.createAll(Objects.requireNonNull(config, "AnalysisConfig must not be null")));
    }

    ReportAssembler(AnalysisConfig config, Clock clock, List<AnomalyDetector> detectors) {
        this.config = Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.detectors = List.copyOf(detectors);
        if (this.detectors.isEmpty() || config.getQuorum() > this.detectors.size()) {
            throw new ConfigurationException(List.of("quorum " + config.getQuorum()
                    + " cannot be met by " + this.detectors.size() + " detector(s)"));
        }
        this.aggregator = new ConsensusAggregator(config.getQuorum());
        this.baselineAnalyzer = new BaselineShiftAnalyzer(config.getBaselineStart(), config.getBaselineCutoff());
        this.correlator = new EventCorrelator(config.getEventCalendar(), config.getCorrelationWindowDays());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Analyse every requested term and assemble the report.
     *
     * @param dataset series per term
     * @param terms   terms to analyse; duplicates are analysed once
     * @return the assembled report
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting for parallel workers
     */
    public AnomalyReport assemble(SeriesDataset dataset, List<String> terms) {
        Objects.requireNonNull(dataset, "SeriesDataset must not be null");
        Objects.requireNonNull(terms, "Terms must not be null");

        List<String> requested = new ArrayList<>(new LinkedHashSet<>(terms));
        LOG.info("Assembling anomaly report for {} term(s) with {} detector(s), quorum={}",
                requested.size(), detectors.size(), config.getQuorum());

        List<TermOutcome> outcomes = config.getParallelism() > 1 && requested.size() > 1
                ? analyzeInParallel(dataset, requested)
                : analyzeSequentially(dataset, requested);

        AnomalyReport.Builder report = AnomalyReport.builder()
                .generatedAt(clock.instant())
                .termsAnalyzed(requested);
        List<AnomalyRecord> highConfidence = new ArrayList<>();

        for (TermOutcome outcome : outcomes) {
            if (outcome.omission != null) {
                report.omission(outcome.omission);
                continue;
            }
            report.anomalies(outcome.summary).baselineShift(outcome.baselineShift);
            highConfidence.addAll(outcome.summary.getAnomalies());
        }

        List<EventCorrelation> correlations = correlator.correlate(highConfidence);
        AnomalyReport result = report.eventCorrelations(correlations).build();

        LOG.info("Report complete: {} term(s) analysed, {} omitted, {} high-confidence anomaly(ies), "
                + "{} event correlation(s)",
                result.getAnomaliesByTerm().size(), result.getOmissions().size(), highConfidence.size(),
                correlations.size());
        return result;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    // ---------------------------------------------------------------
    // Per-term analysis
    // ---------------------------------------------------------------

    private List<TermOutcome> analyzeSequentially(SeriesDataset dataset, List<String> terms) {
        List<TermOutcome> outcomes = new ArrayList<>(terms.size());
        for (String term : terms) {
            outcomes.add(analyzeTerm(dataset, term));
        }
        return outcomes;
    }

    private List<TermOutcome> analyzeInParallel(SeriesDataset dataset, List<String> terms) {
        int threads = Math.min(config.getParallelism(), terms.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        try {
            List<Future<TermOutcome>> futures = new ArrayList<>(terms.size());
            for (String term : terms) {
                futures.add(pool.submit(() -> analyzeTerm(dataset, term)));
            }
            List<TermOutcome> outcomes = new ArrayList<>(terms.size());
            for (Future<TermOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for term analysis", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Term analysis worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private TermOutcome analyzeTerm(SeriesDataset dataset, String term) {
        Optional<Series> found = dataset.find(term);
        if (found.isEmpty()) {
            LOG.warn("No series for term '{}'; skipping", term);
            return TermOutcome.omitted(new TermOmission(term, TermOmission.Reason.DATA_ABSENT,
                    "No series for term in dataset"));
        }

        Series series = found.get();
        try {
            Map<String, SortedSet<LocalDate>> flagged = new LinkedHashMap<>();
            for (AnomalyDetector detector : detectors) {
                flagged.put(detector.getName(), detector.detect(series));
            }
            ConsensusResult consensus = aggregator.aggregate(series, flagged);
            BaselineShiftResult shift = baselineAnalyzer.analyze(series);

            LOG.debug("Term '{}': {} high-confidence anomaly(ies), detector counts {}",
                    term, consensus.getHighConfidence().size(), consensus.detectorCounts());
            return TermOutcome.analyzed(
                    new TermAnomalySummary(term, consensus.getHighConfidence(), consensus.detectorCounts()),
                    shift);
        } catch (RuntimeException e) {
            LOG.error("Analysis of term '{}' failed; continuing with remaining terms", term, e);
            return TermOutcome.omitted(new TermOmission(term, TermOmission.Reason.ANALYSIS_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Result of one term: either a summary and baseline shift, or an omission. */
    private static final class TermOutcome {
        final TermAnomalySummary summary;
        final BaselineShiftResult baselineShift;
        final TermOmission omission;

        private TermOutcome(TermAnomalySummary summary, BaselineShiftResult baselineShift, TermOmission omission) {
            this.summary = summary;
            this.baselineShift = baselineShift;
            this.omission = omission;
        }

        static TermOutcome analyzed(TermAnomalySummary summary, BaselineShiftResult baselineShift) {
            return new TermOutcome(summary, baselineShift, null);
        }

        static TermOutcome omitted(TermOmission omission) {
            return new TermOutcome(null, null, omission);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "report-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    @Override
    public String toString() {
        return "ReportAssembler{detectors=" + detectors.stream().map(AnomalyDetector::getName).toList()
                + ", config=" + config + '}';
    }
}
