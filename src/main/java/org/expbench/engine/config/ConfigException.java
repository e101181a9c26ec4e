package org.expbench.engine.config;

/**
 * Raised when experiment or metric configuration is invalid.
 * Configuration errors are fatal and are always raised before any SQL is rendered.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
