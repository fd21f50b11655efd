package com.ai.assistant.exception;

/**
 * Missing or invalid dialogue configuration. Raised at startup; never per turn.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
