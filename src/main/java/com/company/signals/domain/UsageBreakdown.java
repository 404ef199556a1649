package com.company.signals.domain;

import lombok.Value;

import java.util.List;

@Value
public class UsageBreakdown {
    String timeRange;
    String orgFilter;
    List<OrgUsage> llmUsage;
    List<OrgUsage> otherUsage;
}
