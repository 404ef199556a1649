package com.company.signals.service;

import com.company.signals.analysis.DiagnosisComposer;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.client.SentryEventParser;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.ErrorRecord;
import com.company.signals.exception.ErrorTrackingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class DiagnosisService {

    private final ErrorTrackingClient errorTrackingClient;
    private final SentryEventParser parser;
    private final DiagnosisComposer composer;
    private final SignalsProperties properties;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    public Diagnosis diagnose(String issueId) {
        JsonNode issue = errorTrackingClient.getIssue(issueId);
        return diagnoseIssue(issue);
    }

    /**
     * Diagnose an issue payload already in hand. The latest event only adds stack,
     * breadcrumbs and tags, so failing to fetch it still yields a diagnosis.
     */
    public Diagnosis diagnoseIssue(JsonNode issue) {
        String issueId = issue.path("id").asText();
        Span span = tracer.spanBuilder("signals.diagnose")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("issue.id", issueId);

            JsonNode latestEvent = fetchLatestEvent(issueId);
            ErrorRecord record = parser.toErrorRecord(issue, latestEvent);
            Diagnosis diagnosis = diagnose(record);

            span.setAttribute("diagnosis.category", diagnosis.getCategory());
            span.setAttribute("diagnosis.severity", diagnosis.getSeverity().label());
            log.info("Diagnosis for issue {}: [{}] {}", issueId, diagnosis.getSeverity().label(), diagnosis.getCategory());
            return diagnosis;
        } finally {
            span.end();
        }
    }

    public Diagnosis diagnose(ErrorRecord record) {
        Diagnosis diagnosis = composer.compose(record,
                properties.getDiagnosisPatterns(),
                properties.getKnownIssues(),
                properties.getServices());

        meterRegistry.counter("signals.diagnosis",
                "category", diagnosis.getCategory(),
                "severity", diagnosis.getSeverity().label()).increment();
        return diagnosis;
    }

    private JsonNode fetchLatestEvent(String issueId) {
        try {
            return errorTrackingClient.getLatestEvent(issueId);
        } catch (ErrorTrackingException e) {
            log.warn("Could not fetch latest event for issue {}: {}", issueId, e.getMessage());
            meterRegistry.counter("signals.diagnosis.latest_event.missing").increment();
            return null;
        }
    }
}
