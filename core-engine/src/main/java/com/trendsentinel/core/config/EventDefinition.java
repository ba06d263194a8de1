package com.trendsentinel.core.config;

/**
 * One calendar entry as written in the YAML configuration.
 *
 * <pre>
 * events:
 *   - date: "2020-03-11"
 *     label: WHO declares COVID-19 pandemic
 * </pre>
 *
 * @since 1.0.0
 */
public class EventDefinition {

    /** ISO-8601 calendar date. */
    private String date;

    /** Human-readable event label. */
    private String label;

    public EventDefinition() {
    }

    public EventDefinition(String date, String label) {
        this.date = date;
        this.label = label;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return "EventDefinition{date='" + date + "', label='" + label + "'}";
    }
}
