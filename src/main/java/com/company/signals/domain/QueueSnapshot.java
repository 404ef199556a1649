package com.company.signals.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class QueueSnapshot {
    int lookbackHours;
    long total;
    long pending;
    long sent;
    long deadLetter;
    long currentlyLeased;
    long stuckLeases;

    @Singular
    List<String> anomalies;

    @Singular
    List<String> recommendations;

    @Singular("throughputRow")
    List<HourlyThroughput> throughputPerHour;

    @Singular
    List<ErrorGroup> topErrors;

    public boolean isHealthy() {
        return anomalies.isEmpty();
    }
}
