package com.company.signals.service;

import com.company.signals.cache.AutoResolveRateLimiter;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.domain.AutoResolveDecision;
import com.company.signals.domain.Diagnosis;
import com.company.signals.dto.response.TriageResponse;
import com.company.signals.event.IssueTriagedEvent;
import com.company.signals.exception.ErrorTrackingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Handles error-tracker alert webhooks: diagnoses the issue and, when policy and
 * the hourly limit allow, resolves it on the spot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TriageService {

    private static final Set<String> PROCESSED_ACTIONS = Set.of("triggered", "created");

    private final DiagnosisService diagnosisService;
    private final AutoResolvePolicy autoResolvePolicy;
    private final AutoResolveRateLimiter rateLimiter;
    private final ErrorTrackingClient errorTrackingClient;
    private final RunbookService runbookService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public TriageResponse handle(JsonNode payload) {
        String action = payload.path("action").asText("");
        JsonNode issue = payload.path("data").path("issue");

        if (!issue.isObject()) {
            return TriageResponse.skipped("No issue data in payload");
        }
        if (!PROCESSED_ACTIONS.contains(action)) {
            log.info("Ignoring webhook action: {}", action);
            return TriageResponse.skipped("Action \"" + action + "\" not processed");
        }

        String issueId = issue.path("id").asText();
        String project = issue.path("project").path("slug").asText("unknown");
        log.info("Processing alert for issue {} in {} (action: {})", issueId, project, action);

        Diagnosis diagnosis = diagnosisService.diagnoseIssue(issue);
        AutoResolveDecision decision = autoResolvePolicy.decide(diagnosis);

        if (decision.isShouldResolve()) {
            if (rateLimiter.canResolve()) {
                if (autoResolve(issueId, diagnosis, decision)) {
                    meterRegistry.counter("signals.triage", "outcome", TriageResponse.AUTO_RESOLVED).increment();
                    eventPublisher.publishEvent(new IssueTriagedEvent(issueId, project, diagnosis, true));
                    return TriageResponse.builder()
                            .accepted(true)
                            .action(TriageResponse.AUTO_RESOLVED)
                            .issueId(issueId)
                            .category(diagnosis.getCategory())
                            .reason(decision.getReason())
                            .diagnosis(diagnosis.getSummary())
                            .build();
                }
            } else {
                log.warn("Auto-resolve limit of {}/h reached, leaving issue {} open",
                        rateLimiter.getMaxPerHour(), issueId);
            }
        }

        meterRegistry.counter("signals.triage", "outcome", TriageResponse.TRIAGED).increment();
        eventPublisher.publishEvent(new IssueTriagedEvent(issueId, project, diagnosis, false));
        return TriageResponse.builder()
                .accepted(true)
                .action(TriageResponse.TRIAGED)
                .issueId(issueId)
                .category(diagnosis.getCategory())
                .severity(diagnosis.getSeverity())
                .autoResolve(decision)
                .runbook(diagnosis.getSeverity().requiresHumanReview()
                        ? runbookService.runbookFor(diagnosis.getCategory(), diagnosis.getContext().getService())
                        : null)
                .build();
    }

    /**
     * @return false when the tracker refused the status change, the issue then stays triaged
     */
    private boolean autoResolve(String issueId, Diagnosis diagnosis, AutoResolveDecision decision) {
        try {
            errorTrackingClient.updateStatus(issueId, decision.getAction(), decision.getIgnoreMinutes());
        } catch (ErrorTrackingException e) {
            log.error("Failed to auto-resolve issue {}", issueId, e);
            return false;
        }

        try {
            rateLimiter.record(issueId, diagnosis.getCategory());
        } catch (RuntimeException e) {
            log.error("Issue {} resolved but not counted against the auto-resolve limit", issueId, e);
        }
        log.info("Auto-resolved issue {} ({}): {}", issueId, diagnosis.getCategory(), decision.getReason());
        return true;
    }
}
