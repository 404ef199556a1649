package com.company.signals.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class DeadLetterEvent {
    String id;
    String orgId;
    Instant createdAt;
    String lastError;
}
