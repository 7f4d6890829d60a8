package com.raredisease.prioritization.config;

/**
 * Thrown at startup when the prioritization configuration is invalid.
 * Configuration errors are the only fatal errors of a run.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
