package com.company.signals.service;

import com.company.signals.analysis.QueueHealthAnalyzer;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.ErrorGroup;
import com.company.signals.domain.HourlyThroughput;
import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.QueueSnapshot;
import com.company.signals.repository.OutboxRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxHealthServiceTest {

    @Mock
    private OutboxRepository outboxRepository;

    private SimpleMeterRegistry meterRegistry;
    private OutboxHealthService outboxHealthService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        outboxHealthService = new OutboxHealthService(
                outboxRepository, new QueueHealthAnalyzer(), new SignalsProperties(), meterRegistry, Runnable::run);
    }

    @Test
    void combinesAllAggregates() {
        when(outboxRepository.countQueue(24)).thenReturn(
                QueueCounters.builder().total(1000).pending(650).sent(350).deadLetter(2).build());
        when(outboxRepository.countStuckLeases()).thenReturn(1L);
        when(outboxRepository.hourlyThroughput(24)).thenReturn(
                List.of(new HourlyThroughput(Instant.parse("2024-03-01T11:00:00Z"), 120)));
        when(outboxRepository.topErrors(24)).thenReturn(List.of(new ErrorGroup("HTTP 503", 2)));

        QueueSnapshot snapshot = outboxHealthService.checkHealth(24);

        assertThat(snapshot.getLookbackHours()).isEqualTo(24);
        assertThat(snapshot.getStuckLeases()).isEqualTo(1);
        assertThat(snapshot.getAnomalies()).hasSize(3);
        assertThat(snapshot.getAnomalies().get(0)).isEqualTo("HIGH QUEUE DEPTH: 650 pending (threshold: 500)");
        assertThat(snapshot.getThroughputPerHour()).hasSize(1);
        assertThat(snapshot.getTopErrors()).extracting(ErrorGroup::getLastError).containsExactly("HTTP 503");
        assertThat(meterRegistry.get("signals.outbox.pending").gauge().value()).isEqualTo(650.0);
    }

    @Test
    void failedAggregateIsReportedAsEmpty() {
        when(outboxRepository.countQueue(6)).thenReturn(
                QueueCounters.builder().total(10).pending(1).sent(9).build());
        when(outboxRepository.countStuckLeases()).thenReturn(0L);
        when(outboxRepository.hourlyThroughput(6)).thenThrow(new DataAccessResourceFailureException("down"));
        when(outboxRepository.topErrors(6)).thenReturn(List.of());

        QueueSnapshot snapshot = outboxHealthService.checkHealth(6);

        assertThat(snapshot.isHealthy()).isTrue();
        assertThat(snapshot.getThroughputPerHour()).isEmpty();
        assertThat(meterRegistry.counter("signals.outbox.query.failures", "query", "hourly throughput").count())
                .isEqualTo(1.0);
    }

    @Test
    void currentCountersPropagateFailures() {
        when(outboxRepository.countQueue(1)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> outboxHealthService.currentCounters(1))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void thresholdsComeFromConfiguration() {
        assertThat(outboxHealthService.thresholds().getQueueDepth()).isEqualTo(500);
        assertThat(outboxHealthService.thresholds().getDeadLetter()).isEqualTo(10);
    }
}
