package com.company.signals.domain;

import lombok.Value;

/**
 * Outbox rows sharing the same last delivery error
 */
@Value
public class ErrorGroup {
    String lastError;
    long count;
}
