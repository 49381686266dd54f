package com.terralint.core.config;

/**
 * Thrown when lint options name an unknown rule id, category or severity, or carry
 * out-of-range values. Raised before any file is read.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
