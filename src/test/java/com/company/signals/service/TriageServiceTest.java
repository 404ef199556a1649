package com.company.signals.service;

import com.company.signals.cache.AutoResolveRateLimiter;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.DiagnosisContext;
import com.company.signals.domain.enums.ResolveAction;
import com.company.signals.domain.enums.Severity;
import com.company.signals.dto.response.TriageResponse;
import com.company.signals.event.IssueTriagedEvent;
import com.company.signals.exception.ErrorTrackingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageServiceTest {

    @Mock
    private DiagnosisService diagnosisService;

    @Mock
    private AutoResolveRateLimiter rateLimiter;

    @Mock
    private ErrorTrackingClient errorTrackingClient;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SignalsProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private TriageService triageService;

    @BeforeEach
    void setUp() {
        properties = new SignalsProperties();
        properties.getAutoResolve().setEnabled(true);
        properties.getAutoResolve().setCategories(List.of("validation_error"));
        meterRegistry = new SimpleMeterRegistry();
        triageService = new TriageService(
                diagnosisService,
                new AutoResolvePolicy(properties),
                rateLimiter,
                errorTrackingClient,
                new RunbookService(properties),
                eventPublisher,
                meterRegistry);
    }

    @Test
    void skipsPayloadWithoutIssue() throws Exception {
        TriageResponse response = triageService.handle(objectMapper.readTree("{\"action\": \"triggered\"}"));

        assertThat(response.isAccepted()).isTrue();
        assertThat(response.getAction()).isEqualTo(TriageResponse.SKIPPED);
        assertThat(response.getReason()).isEqualTo("No issue data in payload");
        verifyNoInteractions(diagnosisService);
    }

    @Test
    void skipsUnprocessedActions() throws Exception {
        TriageResponse response = triageService.handle(payload("resolved"));

        assertThat(response.getAction()).isEqualTo(TriageResponse.SKIPPED);
        assertThat(response.getReason()).isEqualTo("Action \"resolved\" not processed");
        verifyNoInteractions(diagnosisService);
    }

    @Test
    void autoResolvesWithinLimit() throws Exception {
        JsonNode payload = payload("triggered");
        when(diagnosisService.diagnoseIssue(any())).thenReturn(diagnosis("validation_error", Severity.LOW));
        when(rateLimiter.canResolve()).thenReturn(true);

        TriageResponse response = triageService.handle(payload);

        assertThat(response.getAction()).isEqualTo(TriageResponse.AUTO_RESOLVED);
        assertThat(response.getIssueId()).isEqualTo("42");
        assertThat(response.getReason())
                .isEqualTo("Category \"validation_error\" in auto-resolve list, severity is low");
        verify(errorTrackingClient).updateStatus("42", ResolveAction.RESOLVE, null);
        verify(rateLimiter).record("42", "validation_error");

        ArgumentCaptor<IssueTriagedEvent> event = ArgumentCaptor.forClass(IssueTriagedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().isAutoResolved()).isTrue();
        assertThat(event.getValue().getProject()).isEqualTo("gateway");
        assertThat(meterRegistry.counter("signals.triage", "outcome", "auto_resolved").count()).isEqualTo(1.0);
    }

    @Test
    void limitReachedLeavesIssueTriaged() throws Exception {
        when(diagnosisService.diagnoseIssue(any())).thenReturn(diagnosis("validation_error", Severity.LOW));
        when(rateLimiter.canResolve()).thenReturn(false);

        TriageResponse response = triageService.handle(payload("created"));

        assertThat(response.getAction()).isEqualTo(TriageResponse.TRIAGED);
        assertThat(response.getAutoResolve().isShouldResolve()).isTrue();
        verify(errorTrackingClient, never()).updateStatus(any(), any(), any());
    }

    @Test
    void trackerFailureFallsBackToTriaged() throws Exception {
        when(diagnosisService.diagnoseIssue(any())).thenReturn(diagnosis("validation_error", Severity.LOW));
        when(rateLimiter.canResolve()).thenReturn(true);
        when(errorTrackingClient.updateStatus("42", ResolveAction.RESOLVE, null))
                .thenThrow(new ErrorTrackingException("Sentry unavailable"));

        TriageResponse response = triageService.handle(payload("triggered"));

        assertThat(response.getAction()).isEqualTo(TriageResponse.TRIAGED);
        verify(rateLimiter, never()).record(any(), any());
    }

    @Test
    void highSeverityGetsRunbookAndStaysOpen() throws Exception {
        when(diagnosisService.diagnoseIssue(any())).thenReturn(diagnosis("database_error", Severity.CRITICAL));

        TriageResponse response = triageService.handle(payload("triggered"));

        assertThat(response.getAction()).isEqualTo(TriageResponse.TRIAGED);
        assertThat(response.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(response.getAutoResolve().getReason()).isEqualTo("Severity is critical - requires human review");
        assertThat(response.getRunbook()).isNotNull();
        assertThat(response.getRunbook().getService()).isEqualTo("ledger-api");
        verifyNoInteractions(rateLimiter, errorTrackingClient);
    }

    @Test
    void lowSeverityTriagedWithoutRunbook() throws Exception {
        when(diagnosisService.diagnoseIssue(any())).thenReturn(diagnosis("network_error", Severity.LOW));

        TriageResponse response = triageService.handle(payload("triggered"));

        assertThat(response.getAction()).isEqualTo(TriageResponse.TRIAGED);
        assertThat(response.getRunbook()).isNull();
    }

    private JsonNode payload(String action) throws Exception {
        return objectMapper.readTree("""
                {"action": "%s", "data": {"issue": {"id": "42", "title": "Boom", "project": {"slug": "gateway"}}}}
                """.formatted(action));
    }

    private static Diagnosis diagnosis(String category, Severity severity) {
        return Diagnosis.builder()
                .category(category)
                .severity(severity)
                .summary("[" + severity.name() + "] " + category + ": Boom")
                .rootCause("cause")
                .context(DiagnosisContext.builder().service("ledger-api").build())
                .suggestions(List.of())
                .build();
    }
}
