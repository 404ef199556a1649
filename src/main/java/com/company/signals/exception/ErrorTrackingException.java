package com.company.signals.exception;

/**
 * Raised when the error tracker cannot be reached or rejects a request
 */
public class ErrorTrackingException extends RuntimeException {
    public ErrorTrackingException(String message) {
        super(message);
    }

    public ErrorTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
