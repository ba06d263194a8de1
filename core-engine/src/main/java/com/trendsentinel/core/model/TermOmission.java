package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * A requested term that is missing from the report, and why.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "term", "reason", "message" })
public final class TermOmission implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Why a term could not be analysed. */
    public enum Reason {
        /** The dataset holds no series for the term. */
        DATA_ABSENT,
        /** Analysis of the term failed unexpectedly. */
        ANALYSIS_FAILED
    }

    private final String term;
    private final Reason reason;
    private final String message;

    public TermOmission(String term, Reason reason, String message) {
        this.term = Objects.requireNonNull(term, "term must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.message = message;
    }

    @JsonProperty("term")
    public String getTerm() {
        return term;
    }

    @JsonProperty("reason")
    public Reason getReason() {
        return reason;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TermOmission that))
            return false;
        return term.equals(that.term) && reason == that.reason && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, reason, message);
    }

    @Override
    public String toString() {
        return "TermOmission{term='" + term + "', reason=" + reason + ", message='" + message + "'}";
    }
}
