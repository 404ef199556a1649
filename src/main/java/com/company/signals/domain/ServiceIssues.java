package com.company.signals.domain;

import lombok.Value;

import java.util.List;

/**
 * Issues returned by one per-service query
 */
@Value
public class ServiceIssues {
    String service;
    List<IssueSummary> issues;

    public static ServiceIssues empty(String service) {
        return new ServiceIssues(service, List.of());
    }
}
