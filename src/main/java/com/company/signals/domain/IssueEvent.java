package com.company.signals.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IssueEvent {
    String eventId;
    String timestamp;
    String message;
    String traceId;
    String runId;
    String service;
    String environment;
    String release;
}
