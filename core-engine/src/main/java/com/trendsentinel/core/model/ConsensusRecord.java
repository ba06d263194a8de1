package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Number of detectors that flagged a given date for one term.
 *
 * @since 1.0.0
 */
public final class ConsensusRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final String term;
    private final int agreementCount;

    public ConsensusRecord(LocalDate date, String term, int agreementCount) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.term = Objects.requireNonNull(term, "term must not be null");
        if (agreementCount < 1) {
            throw new IllegalArgumentException("agreementCount must be >= 1, got: " + agreementCount);
        }
        this.agreementCount = agreementCount;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getTerm() {
        return term;
    }

    public int getAgreementCount() {
        return agreementCount;
    }

    /**
     * @param quorum minimum number of agreeing detectors
     * @return {@code true} if this date reaches the quorum
     */
    public boolean isHighConfidence(int quorum) {
        return agreementCount >= quorum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConsensusRecord that))
            return false;
        return agreementCount == that.agreementCount
                && date.equals(that.date)
                && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, term, agreementCount);
    }

    @Override
    public String toString() {
        return "ConsensusRecord{date=" + date + ", term='" + term + "', agreementCount=" + agreementCount + '}';
    }
}
