package io.fanlog;

/**
 * Thrown synchronously when a destination is constructed, or a registry setting is changed,
 * with invalid input.
 *
 * <p>Configuration problems are never deferred to write time.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
