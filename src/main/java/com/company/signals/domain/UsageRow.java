package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-org recent and baseline aggregates. The baseline is already scaled to the
 * recent window length. A null value means the org had no rows in that window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRow {
    private String orgId;
    private Double recentTokens;
    private Double recentRequests;
    private Double baselineTokens;
    private Double baselineRequests;
}
