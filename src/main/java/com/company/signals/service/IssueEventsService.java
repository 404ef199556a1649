package com.company.signals.service;

import com.company.signals.analysis.TemporalPatternDetector;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.client.SentryEventParser;
import com.company.signals.domain.IssueEvent;
import com.company.signals.domain.IssueEventTimeline;
import com.company.signals.domain.TemporalVerdict;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recent events of one issue with their temporal pattern and spread
 */
@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class IssueEventsService {

    public static final int DEFAULT_LIMIT = 25;

    private final ErrorTrackingClient errorTrackingClient;
    private final SentryEventParser parser;
    private final TemporalPatternDetector patternDetector;

    public IssueEventTimeline analyzeEvents(String issueId, @Min(1) @Max(100) int limit) {
        JsonNode rawEvents = errorTrackingClient.getIssueEvents(issueId, limit);

        List<IssueEvent> events = new ArrayList<>();
        if (rawEvents != null) {
            rawEvents.forEach(event -> events.add(parser.toIssueEvent(event)));
        }

        // events without a creation date cannot be placed on the timeline
        List<String> timestamps = events.stream()
                .map(IssueEvent::getTimestamp)
                .filter(ts -> ts != null && !ts.isBlank())
                .collect(Collectors.toList());
        TemporalVerdict pattern = patternDetector.classify(timestamps);

        log.debug("Issue {}: {} events, pattern {}", issueId, events.size(), pattern.getPattern().label());
        return new IssueEventTimeline(
                events.size(),
                pattern,
                distinct(events, IssueEvent::getService),
                distinct(events, IssueEvent::getEnvironment),
                events);
    }

    private static List<String> distinct(List<IssueEvent> events, Function<IssueEvent, String> field) {
        return events.stream()
                .map(field)
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .distinct()
                .collect(Collectors.toList());
    }
}
