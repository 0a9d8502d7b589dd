package com.aporkolab.reliability.exception;

/**
 * Invalid setup parameter. Carries the name of the offending field.
 */
public class ConfigurationException extends ReliabilityException {

    public static final String CODE = "CONFIGURATION_ERROR";

    private final String field;

    public ConfigurationException(String field, String message) {
        super(CODE, String.format("Invalid configuration for '%s': %s", field, message));
        this.field = field;
        with("field", field);
    }

    public ConfigurationException(String field, String message, Throwable cause) {
        super(CODE, String.format("Invalid configuration for '%s': %s", field, message), cause);
        this.field = field;
        with("field", field);
    }

    public String getField() {
        return field;
    }

    /**
     * Fails with a ConfigurationException when the value is null or blank.
     */
    public static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field, "must not be null or blank");
        }
        return value;
    }

    public static <T> T requireNonNull(String field, T value) {
        if (value == null) {
            throw new ConfigurationException(field, "must not be null");
        }
        return value;
    }
}
