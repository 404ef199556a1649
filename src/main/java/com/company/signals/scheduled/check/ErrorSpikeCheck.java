package com.company.signals.scheduled.check;

import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.CheckResult;
import com.company.signals.domain.IssueSummary;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.exception.ErrorTrackingException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about unresolved issues with a high event count in any watched project
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorSpikeCheck implements PeriodicCheck {

    static final int ISSUES_PER_PROJECT = 5;
    static final int TITLE_LENGTH = 80;

    private final ErrorTrackingClient errorTrackingClient;
    private final SignalsProperties properties;

    @Override
    public String name() {
        return "error_spike";
    }

    @Override
    public CheckResult run() {
        List<String> projects = properties.getSentry().getProjects();
        if (projects.isEmpty()) {
            return CheckResult.ok(name(), "No Sentry projects configured");
        }

        long threshold = properties.getPeriodicChecks().getErrorSpikeCount();
        List<Spike> spikes = new ArrayList<>();
        for (String project : projects) {
            try {
                for (IssueSummary issue : errorTrackingClient.listIssues(project, "is:unresolved", ISSUES_PER_PROJECT, "freq")) {
                    if (issue.getCount() > threshold) {
                        spikes.add(new Spike(project, issue.getId(), truncate(issue.getTitle()), issue.getCount()));
                    }
                }
            } catch (ErrorTrackingException e) {
                log.warn("Skipping project {} in error spike check: {}", project, e.getMessage());
            }
        }

        if (spikes.isEmpty()) {
            return CheckResult.ok(name(), "No error spikes detected");
        }
        return new CheckResult(name(), CheckStatus.WARN, spikes.size() + " high-frequency issues detected", spikes);
    }

    private static String truncate(String title) {
        if (title == null) {
            return "";
        }
        return title.length() > TITLE_LENGTH ? title.substring(0, TITLE_LENGTH) : title;
    }

    @Value
    static class Spike {
        String project;
        String issueId;
        String title;
        long count;
    }
}
