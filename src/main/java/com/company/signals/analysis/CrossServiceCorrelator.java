package com.company.signals.analysis;

import com.company.signals.domain.CorrelationKey;
import com.company.signals.domain.CorrelationResult;
import com.company.signals.domain.IssueSummary;
import com.company.signals.domain.ServiceIssues;
import com.company.signals.exception.MissingCorrelationKeyException;
import com.company.signals.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges per-service issue lists found for one trace or run into a single timeline
 */
@Component
public class CrossServiceCorrelator {

    private static final Comparator<IssueSummary> MOST_RECENT_FIRST = Comparator.comparing(
            (IssueSummary issue) -> TimeUtils.parseTimestamp(issue.getLastSeen()).orElse(null),
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    public CorrelationResult correlate(CorrelationKey key, List<ServiceIssues> perServiceResults) {
        if (key == null) {
            throw new MissingCorrelationKeyException("Provide at least one of traceId or runId");
        }

        Set<String> seenIds = new HashSet<>();
        List<IssueSummary> timeline = new ArrayList<>();
        for (ServiceIssues result : perServiceResults) {
            for (IssueSummary issue : result.getIssues()) {
                // first occurrence wins, later copies from other service queries are dropped
                if (!seenIds.add(issue.getId())) {
                    continue;
                }
                if (issue.getProject() == null || issue.getProject().isBlank()) {
                    issue = issue.toBuilder().project(result.getService()).build();
                }
                timeline.add(issue);
            }
        }

        timeline.sort(MOST_RECENT_FIRST);

        Set<String> services = new LinkedHashSet<>();
        timeline.forEach(issue -> services.add(issue.getProject()));
        List<String> affectedServices = new ArrayList<>(services);

        return CorrelationResult.builder()
                .traceId(key.getTraceId())
                .runId(key.getRunId())
                .totalIssues(timeline.size())
                .affectedServices(affectedServices)
                .cascadeDetected(affectedServices.size() > 1)
                .timeline(timeline)
                .analysis(analysisFor(affectedServices))
                .build();
    }

    private String analysisFor(List<String> services) {
        if (services.size() > 1) {
            return "Cross-service error cascade detected across " + String.join(", ", services)
                    + ". Investigate the oldest issue first.";
        }
        if (services.size() == 1) {
            return "Errors isolated to " + services.get(0) + ". No cross-service cascade.";
        }
        return "No errors found for this trace/run across any project.";
    }
}
