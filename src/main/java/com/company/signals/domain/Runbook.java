package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Incident runbook for one error category
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Runbook {
    private String category;
    private String service;
    private String title;
    private String severity;

    @Builder.Default
    private List<String> triage = new ArrayList<>();

    @Builder.Default
    private List<String> diagnose = new ArrayList<>();

    @Builder.Default
    private List<String> mitigate = new ArrayList<>();

    @Builder.Default
    private List<String> resolve = new ArrayList<>();

    @Builder.Default
    private List<String> postmortem = new ArrayList<>();
}
