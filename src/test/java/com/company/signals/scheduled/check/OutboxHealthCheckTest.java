package com.company.signals.scheduled.check;

import com.company.signals.analysis.QueueHealthAnalyzer;
import com.company.signals.domain.CheckResult;
import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.QueueThresholds;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.service.OutboxHealthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxHealthCheckTest {

    @Mock
    private OutboxHealthService outboxHealthService;

    private OutboxHealthCheck check;

    @BeforeEach
    void setUp() {
        check = new OutboxHealthCheck(outboxHealthService, new QueueHealthAnalyzer());
        when(outboxHealthService.thresholds()).thenReturn(new QueueThresholds(500, 10));
    }

    @Test
    void healthyQueue() {
        when(outboxHealthService.currentCounters(1)).thenReturn(QueueCounters.builder().pending(12).build());

        CheckResult result = check.run();

        assertThat(result.getStatus()).isEqualTo(CheckStatus.OK);
        assertThat(result.getMessage()).isEqualTo("Healthy: 12 pending, 0 dead letters");
    }

    @Test
    void deepQueueWarns() {
        when(outboxHealthService.currentCounters(1)).thenReturn(QueueCounters.builder().pending(800).build());

        CheckResult result = check.run();

        assertThat(result.getStatus()).isEqualTo(CheckStatus.WARN);
        assertThat(result.getMessage()).isEqualTo("800 pending (threshold: 500)");
    }

    @Test
    void deadLettersAndStuckLeasesAreCritical() {
        when(outboxHealthService.currentCounters(1)).thenReturn(
                QueueCounters.builder().pending(10).deadLetter(3).stuckLeases(2).build());

        CheckResult result = check.run();

        assertThat(result.getStatus()).isEqualTo(CheckStatus.CRITICAL);
        assertThat(result.getMessage()).isEqualTo("3 dead letters; 2 stuck leases");
    }
}
