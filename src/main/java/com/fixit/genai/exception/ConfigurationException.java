package com.fixit.genai.exception;

/**
 * Invalid scoring configuration (weights not summing to 1.0, thresholds outside [0,1], ...).
 * Surfaces while the configuration beans are built, so the application refuses to start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
