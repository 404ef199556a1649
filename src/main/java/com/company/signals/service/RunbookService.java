package com.company.signals.service;

import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.Runbook;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RunbookService {

    private final SignalsProperties properties;

    /**
     * Configured runbook for the category, or a generic five-phase runbook
     *
     * @param service optional service context, "all" when absent
     */
    public Runbook runbookFor(String category, String service) {
        String scope = service == null || service.isBlank() ? "all" : service;
        Runbook configured = properties.getRunbooks().get(category);
        if (configured != null) {
            return configured.toBuilder()
                    .category(category)
                    .service(scope)
                    .build();
        }
        return genericRunbook(category, scope);
    }

    private Runbook genericRunbook(String category, String service) {
        return Runbook.builder()
                .category(category)
                .service(service)
                .title(category + " Incident")
                .severity("MEDIUM")
                .triage(List.of(
                        "Check Sentry for error volume and trend",
                        "Identify affected services",
                        "Check if it started after a deployment"))
                .diagnose(List.of(
                        "Read the full stack trace of the latest event",
                        "Correlate by trace_id or run_id to check for a cascade",
                        "Check logs for additional context"))
                .mitigate(List.of(
                        "If critical: rollback deployment",
                        "If isolated: apply targeted fix",
                        "Communicate status to affected users"))
                .resolve(List.of(
                        "Fix the root cause",
                        "Deploy fix and verify",
                        "Resolve the Sentry issue when confirmed fixed"))
                .postmortem(List.of(
                        "Document timeline",
                        "Review alert coverage for this category",
                        "Add test coverage for the scenario"))
                .build();
    }
}
