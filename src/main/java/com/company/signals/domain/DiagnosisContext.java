package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosisContext {
    private String service;
    private String repo;
    private String runtime;
    private String framework;
    private String environment;
    private long eventCount;
    private long userCount;
    private String age;           // "3.2 days" or "unknown"
    private boolean recent;
    private String lastActive;    // "within last hour" or the raw lastSeen value
}
