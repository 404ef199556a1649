package com.company.signals.exception;

public class MissingCorrelationKeyException extends RuntimeException {
    public MissingCorrelationKeyException(String message) {
        super(message);
    }
}
