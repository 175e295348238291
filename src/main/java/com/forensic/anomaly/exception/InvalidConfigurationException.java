package com.forensic.anomaly.exception;

/**
 * Raised when detection parameters describe a nonsensical boundary.
 * Fatal at startup; a rejected per-request override maps to HTTP 400.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String property;

    public InvalidConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
