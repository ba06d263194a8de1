package com.trendsentinel.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendsentinel.core.model.AnomalyReport;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts an {@link AnomalyReport} to JSON for downstream consumers.
 *
 * <p>
 * Dates are written as ISO-8601 strings and fields keep a fixed order, so two
 * equal reports always produce the same bytes.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter() {
        this(false);
    }

    /**
     * @param prettyPrint indent the output for human readers
     */
    public ReportWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    /**
     * @param report the report to serialize
     * @return JSON document
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(AnomalyReport report) {
        return new String(toBytes(report), StandardCharsets.UTF_8);
    }

    /**
     * @param report the report to serialize
     * @return UTF-8 encoded JSON document
     * @throws IllegalStateException if serialization fails
     */
    public byte[] toBytes(AnomalyReport report) {
        Objects.requireNonNull(report, "AnomalyReport must not be null");
        try {
            return mapper.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly report: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Write the report to {@code out}. The stream is left open.
     *
     * @param report the report to serialize
     * @param out    destination stream
     * @throws IOException if writing to the stream fails
     */
    public void write(AnomalyReport report, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "OutputStream must not be null");
        out.write(toBytes(report));
        out.flush();
    }
}
