package com.company.signals.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class HourlyThroughput {
    Instant hour;
    long eventsSent;
}
