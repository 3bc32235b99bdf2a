package com.flowmable.spd;

/**
 * Fatal problem with the run configuration or the input tables.
 * <p>
 * Always raised before any search trial executes; never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
