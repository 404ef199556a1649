package com.company.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class UsageReport {
    String timeRange;
    double spikeThreshold;
    List<UsageComparison> anomalies;
    List<UsageComparison> allOrgs;

    public int getAnomaliesFound() {
        return anomalies.size();
    }
}
