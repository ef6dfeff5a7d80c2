package org.levelforge.core.model.config;

/**
 * Invalid generation request. Always raised before any grid is allocated.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
