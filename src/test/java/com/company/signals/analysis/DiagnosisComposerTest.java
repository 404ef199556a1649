package com.company.signals.analysis;

import com.company.signals.domain.Breadcrumb;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.ErrorRecord;
import com.company.signals.domain.ServiceInfo;
import com.company.signals.domain.Tag;
import com.company.signals.domain.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosisComposerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private DiagnosisComposer composer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        composer = new DiagnosisComposer(new ErrorClassifier(), new SeverityScorer(clock), clock);
    }

    @Test
    void composesContextFromTagsAndTopology() {
        ErrorRecord record = ErrorRecord.builder()
                .title("PrismaClientKnownRequestError: Unique constraint failed")
                .culprit("src/ledger/write.ts")
                .level("error")
                .count(150)
                .userCount(3)
                .firstSeen(NOW.minus(Duration.ofHours(36)).toString())
                .lastSeen(NOW.minus(Duration.ofMinutes(5)).toString())
                .project("api-prod")
                .tag(new Tag("service", "ledger-api"))
                .tag(new Tag("environment", "production"))
                .build();
        Map<String, ServiceInfo> topology = Map.of("ledger-api",
                ServiceInfo.builder().repo("acme/ledger").runtime("node").framework("fastify").build());

        Diagnosis diagnosis = composer.compose(record, List.of(), List.of(), topology);

        assertThat(diagnosis.getCategory()).isEqualTo("database_error");
        assertThat(diagnosis.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(diagnosis.getSummary())
                .isEqualTo("[CRITICAL] database_error: PrismaClientKnownRequestError: Unique constraint failed");
        assertThat(diagnosis.getContext().getService()).isEqualTo("ledger-api");
        assertThat(diagnosis.getContext().getRepo()).isEqualTo("acme/ledger");
        assertThat(diagnosis.getContext().getEnvironment()).isEqualTo("production");
        assertThat(diagnosis.getContext().getAge()).isEqualTo("1.5 days");
        assertThat(diagnosis.getContext().isRecent()).isTrue();
        assertThat(diagnosis.getContext().getLastActive()).isEqualTo("within last hour");
        assertThat(diagnosis.getNextSteps()).containsExactly(
                "Run: cross_correlate with trace_id to check cascade",
                "Run: generate_runbook with category=\"database_error\"",
                "URGENT: Follow runbook mitigation steps");
        assertThat(diagnosis.getBreadcrumbs()).isNull();
    }

    @Test
    void unknownServiceFallsBackToProjectAndUnknownTopology() {
        String lastSeen = NOW.minus(Duration.ofDays(3)).toString();
        ErrorRecord record = ErrorRecord.builder()
                .title("Unexpected value in handler")
                .level("warning")
                .count(2)
                .lastSeen(lastSeen)
                .project("worker")
                .breadcrumb(new Breadcrumb("2024-02-27T10:00:00Z", "http", "GET /health"))
                .build();

        Diagnosis diagnosis = composer.compose(record, List.of(), List.of(), Map.of());

        assertThat(diagnosis.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(diagnosis.getContext().getService()).isEqualTo("worker");
        assertThat(diagnosis.getContext().getRepo()).isEqualTo("unknown");
        assertThat(diagnosis.getContext().getRuntime()).isEqualTo("unknown");
        assertThat(diagnosis.getContext().getEnvironment()).isEqualTo("unknown");
        assertThat(diagnosis.getContext().getAge()).isEqualTo("unknown");
        assertThat(diagnosis.getContext().getLastActive()).isEqualTo(lastSeen);
        assertThat(diagnosis.getNextSteps()).last().isEqualTo("Monitor frequency trend");
        assertThat(diagnosis.getBreadcrumbs()).hasSize(1);
    }
}
