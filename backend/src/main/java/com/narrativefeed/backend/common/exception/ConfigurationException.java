package com.narrativefeed.backend.common.exception;

/**
 * Invalid thresholds or periods. Raised before any work starts.
 */
public class ConfigurationException extends NarrativeFeedException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }

    public static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
        return value;
    }
}
