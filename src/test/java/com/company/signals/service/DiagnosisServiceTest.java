package com.company.signals.service;

import com.company.signals.analysis.DiagnosisComposer;
import com.company.signals.analysis.ErrorClassifier;
import com.company.signals.analysis.SeverityScorer;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.client.SentryEventParser;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.enums.Severity;
import com.company.signals.exception.ErrorTrackingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiagnosisServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private ErrorTrackingClient errorTrackingClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private DiagnosisService diagnosisService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        diagnosisService = new DiagnosisService(
                errorTrackingClient,
                new SentryEventParser(),
                new DiagnosisComposer(new ErrorClassifier(), new SeverityScorer(clock), clock),
                new SignalsProperties(),
                OpenTelemetry.noop().getTracer("test"),
                meterRegistry);
    }

    @Test
    void diagnosesIssueWithLatestEvent() throws Exception {
        when(errorTrackingClient.getIssue("77")).thenReturn(issue());
        when(errorTrackingClient.getLatestEvent("77")).thenReturn(objectMapper.readTree("""
                {"tags": [{"key": "environment", "value": "staging"}], "entries": []}
                """));

        Diagnosis diagnosis = diagnosisService.diagnose("77");

        assertThat(diagnosis.getCategory()).isEqualTo("rate_limit");
        assertThat(diagnosis.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(diagnosis.getContext().getEnvironment()).isEqualTo("staging");
        assertThat(meterRegistry.counter("signals.diagnosis", "category", "rate_limit", "severity", "medium").count())
                .isEqualTo(1.0);
    }

    @Test
    void missingLatestEventStillDiagnoses() throws Exception {
        when(errorTrackingClient.getLatestEvent("77")).thenThrow(new ErrorTrackingException("Sentry unavailable"));

        Diagnosis diagnosis = diagnosisService.diagnoseIssue(issue());

        assertThat(diagnosis.getCategory()).isEqualTo("rate_limit");
        assertThat(diagnosis.getContext().getEnvironment()).isEqualTo("unknown");
        assertThat(meterRegistry.counter("signals.diagnosis.latest_event.missing").count()).isEqualTo(1.0);
    }

    @Test
    void missingIssuePropagates() {
        when(errorTrackingClient.getIssue("404")).thenThrow(new ErrorTrackingException("Issue not found: 404"));

        assertThatThrownBy(() -> diagnosisService.diagnose("404"))
                .isInstanceOf(ErrorTrackingException.class);
    }

    private JsonNode issue() throws Exception {
        return objectMapper.readTree("""
                {
                  "id": "77",
                  "title": "429 Too Many Requests from provider",
                  "level": "error",
                  "count": "40",
                  "userCount": 2,
                  "project": {"slug": "gateway"},
                  "lastSeen": "2024-02-20T12:00:00Z"
                }
                """);
    }
}
