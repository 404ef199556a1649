package com.company.signals.domain;

import lombok.Value;

import java.util.List;

@Value
public class DeadLetterRetryResult {
    int retriedCount;
    List<DeadLetterEvent> events;
    String note;
}
