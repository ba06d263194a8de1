package com.trendsentinel.core.config;

import java.util.List;

/**
 * Thrown when analysis settings are invalid. Raised before any per-term work
 * starts.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ConfigurationException(List<String> errors) {
        super("Invalid analysis configuration:\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    /**
     * @return every validation problem found, one message each
     */
    public List<String> getErrors() {
        return errors;
    }
}
