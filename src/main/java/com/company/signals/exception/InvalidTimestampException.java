package com.company.signals.exception;

public class InvalidTimestampException extends RuntimeException {
    public InvalidTimestampException(String timestamp) {
        super("Invalid event timestamp: " + timestamp);
    }
}
