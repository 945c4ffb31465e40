package com.heronix.decora.exception;

/**
 * Exception thrown when a device API call fails.
 *
 * statusCode is 0 when the request never produced an HTTP response.
 */
public class ApiRequestException extends RuntimeException {

    private final int statusCode;

    public ApiRequestException(String message) {
        this(message, 0);
    }

    public ApiRequestException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
