package com.company.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationResult {
    String traceId;
    String runId;
    int totalIssues;
    List<String> affectedServices;
    boolean cascadeDetected;
    List<IssueSummary> timeline;
    String analysis;
}
