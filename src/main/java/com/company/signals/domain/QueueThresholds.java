package com.company.signals.domain;

import lombok.Value;

@Value
public class QueueThresholds {
    long queueDepth;
    int deadLetter;
}
