package com.heronix.decora.exception;

/**
 * Exception thrown when the configuration file exists but cannot be read or parsed.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
