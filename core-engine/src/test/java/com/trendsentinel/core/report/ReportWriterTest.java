package com.trendsentinel.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendsentinel.core.model.AnomalyRecord;
import com.trendsentinel.core.model.AnomalyReport;
import com.trendsentinel.core.model.BaselineShiftResult;
import com.trendsentinel.core.model.EventCorrelation;
import com.trendsentinel.core.model.TermAnomalySummary;
import com.trendsentinel.core.model.TermOmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private static final LocalDate SPIKE = LocalDate.of(2020, 3, 12);

    private final ObjectMapper reader = new ObjectMapper();
    private AnomalyReport report;

    @BeforeEach
    void setUp() {
        AnomalyRecord anomaly = AnomalyRecord.builder()
                .date(SPIKE)
                .term("depression")
                .value(95)
                .detector("zscore")
                .detector("ensemble")
                .detector("rolling_zscore")
                .build();

        report = AnomalyReport.builder()
                .generatedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .termsAnalyzed(List.of("depression", "burnout", "anxiety"))
                .anomalies(new TermAnomalySummary("depression", List.of(anomaly),
                        Map.of("zscore", 1, "ensemble", 1, "rolling_zscore", 1)))
                .baselineShift(new BaselineShiftResult("depression", 50.0, 55.0, 10.0, 95.0, SPIKE))
                .anomalies(new TermAnomalySummary("burnout", List.of(), Map.of()))
                .baselineShift(new BaselineShiftResult("burnout", 0.0, 3.0, null, 9.0, SPIKE))
                .eventCorrelations(List.of(new EventCorrelation("WHO declares COVID-19 pandemic",
                        LocalDate.of(2020, 3, 11), 1, List.of("depression"))))
                .omission(new TermOmission("anxiety", TermOmission.Reason.DATA_ABSENT, "No series for term in dataset"))
                .build();
    }

    @Test
    @DisplayName("Should write the documented top-level fields")
    void shouldWriteTopLevelFields() throws Exception {
        JsonNode json = reader.readTree(new ReportWriter().toJson(report));

        assertThat(json.fieldNames()).toIterable().containsExactly("analysis_date", "terms_analyzed",
                "anomalies_by_term", "baseline_shift", "event_correlations", "omitted_terms");
        assertThat(json.get("analysis_date").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get("terms_analyzed")).hasSize(3);
    }

    @Test
    @DisplayName("Should write per-term anomalies with ISO dates")
    void shouldWriteAnomalies() throws Exception {
        JsonNode depression = reader.readTree(new ReportWriter().toJson(report))
                .get("anomalies_by_term").get("depression");

        assertThat(depression.get("total_anomalies").asInt()).isEqualTo(1);
        assertThat(depression.get("dates").get(0).asText()).isEqualTo("2020-03-12");
        JsonNode anomaly = depression.get("anomalies").get(0);
        assertThat(anomaly.get("date").asText()).isEqualTo("2020-03-12");
        assertThat(anomaly.get("value").asDouble()).isEqualTo(95.0);
        assertThat(anomaly.has("term")).isFalse();
        assertThat(depression.get("detector_counts").get("ensemble").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Undefined percent change is written as null")
    void shouldWriteNullPercentChange() throws Exception {
        JsonNode shifts = reader.readTree(new ReportWriter().toJson(report)).get("baseline_shift");

        assertThat(shifts.get("depression").get("percent_change").asDouble()).isEqualTo(10.0);
        assertThat(shifts.get("burnout").has("percent_change")).isTrue();
        assertThat(shifts.get("burnout").get("percent_change").isNull()).isTrue();
        assertThat(shifts.get("burnout").get("peak_date").asText()).isEqualTo("2020-03-12");
    }

    @Test
    @DisplayName("Should write event correlations and omissions")
    void shouldWriteCorrelationsAndOmissions() throws Exception {
        JsonNode json = reader.readTree(new ReportWriter().toJson(report));

        JsonNode correlation = json.get("event_correlations").get(0);
        assertThat(correlation.get("event").asText()).isEqualTo("WHO declares COVID-19 pandemic");
        assertThat(correlation.get("event_date").asText()).isEqualTo("2020-03-11");
        assertThat(correlation.get("anomaly_count").asInt()).isEqualTo(1);
        assertThat(correlation.get("terms_affected").get(0).asText()).isEqualTo("depression");

        JsonNode omission = json.get("omitted_terms").get(0);
        assertThat(omission.get("term").asText()).isEqualTo("anxiety");
        assertThat(omission.get("reason").asText()).isEqualTo("DATA_ABSENT");
    }

    @Test
    @DisplayName("write() should emit the same bytes as toBytes()")
    void shouldWriteToStream() throws Exception {
        ReportWriter writer = new ReportWriter(true);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(report, out);

        assertThat(out.toByteArray()).isEqualTo(writer.toBytes(report));
        assertThat(out.toString("UTF-8")).contains("\n");
    }
}
