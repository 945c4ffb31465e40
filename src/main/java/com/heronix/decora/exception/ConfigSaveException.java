package com.heronix.decora.exception;

/**
 * Exception thrown when the configuration file cannot be written.
 */
public class ConfigSaveException extends RuntimeException {

    public ConfigSaveException(String message) {
        super(message);
    }

    public ConfigSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
