package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate outbox counters over a lookback window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueCounters {
    private long total;
    private long pending;
    private long sent;
    private long deadLetter;
    private long currentlyLeased;
    private long stuckLeases;

    public static QueueCounters empty() {
        return new QueueCounters();
    }
}
