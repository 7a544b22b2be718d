package io.fullerstack.atom.config;

/**
 * Raised when a configuration key is missing or holds a value of the wrong type.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
