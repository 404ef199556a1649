package com.company.signals.domain;

import lombok.Value;

import java.util.List;

@Value
public class IssueEventTimeline {
    int total;
    TemporalVerdict pattern;
    List<String> affectedServices;
    List<String> affectedEnvironments;
    List<IssueEvent> events;
}
