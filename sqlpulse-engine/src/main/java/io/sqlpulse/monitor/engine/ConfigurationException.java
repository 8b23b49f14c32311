package io.sqlpulse.monitor.engine;

/**
 * Settings that cannot be read or hold a value with no sensible default
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
