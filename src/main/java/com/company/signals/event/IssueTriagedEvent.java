package com.company.signals.event;

import com.company.signals.domain.Diagnosis;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IssueTriagedEvent {
    private final String issueId;
    private final String project;
    private final Diagnosis diagnosis;
    private final boolean autoResolved;
}
