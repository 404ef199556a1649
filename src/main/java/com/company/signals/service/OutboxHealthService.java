package com.company.signals.service;

import com.company.signals.analysis.QueueHealthAnalyzer;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.ErrorGroup;
import com.company.signals.domain.HourlyThroughput;
import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.QueueSnapshot;
import com.company.signals.domain.QueueThresholds;
import com.company.signals.repository.OutboxRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

@Service
@Slf4j
@Validated
public class OutboxHealthService {

    public static final int DEFAULT_HOURS = 24;

    private final OutboxRepository outboxRepository;
    private final QueueHealthAnalyzer analyzer;
    private final SignalsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Executor queryExecutor;
    private final AtomicLong pendingEvents;

    public OutboxHealthService(OutboxRepository outboxRepository,
                               QueueHealthAnalyzer analyzer,
                               SignalsProperties properties,
                               MeterRegistry meterRegistry,
                               @Qualifier("signalQueryExecutor") Executor queryExecutor) {
        this.outboxRepository = outboxRepository;
        this.analyzer = analyzer;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.queryExecutor = queryExecutor;
        this.pendingEvents = meterRegistry.gauge("signals.outbox.pending", new AtomicLong());
    }

    /**
     * Outbox health over the lookback window. The four aggregates run concurrently;
     * one that fails is reported as zero or empty and the rest still count.
     */
    public QueueSnapshot checkHealth(@Min(1) @Max(168) int hours) {
        CompletableFuture<QueueCounters> counters =
                query("queue counters", () -> outboxRepository.countQueue(hours), QueueCounters.empty());
        CompletableFuture<Long> stuck =
                query("stuck leases", outboxRepository::countStuckLeases, 0L);
        CompletableFuture<List<HourlyThroughput>> throughput =
                query("hourly throughput", () -> outboxRepository.hourlyThroughput(hours), List.of());
        CompletableFuture<List<ErrorGroup>> topErrors =
                query("top errors", () -> outboxRepository.topErrors(hours), List.of());

        CompletableFuture.allOf(counters, stuck, throughput, topErrors).join();

        QueueCounters merged = counters.join();
        merged.setStuckLeases(stuck.join());

        QueueSnapshot snapshot = analyzer.analyze(merged, thresholds()).toBuilder()
                .lookbackHours(hours)
                .throughputPerHour(throughput.join())
                .topErrors(topErrors.join())
                .build();

        pendingEvents.set(merged.getPending());
        if (!snapshot.isHealthy()) {
            log.warn("Outbox unhealthy over last {}h: {}", hours, snapshot.getAnomalies());
        }
        return snapshot;
    }

    /**
     * Counters for the periodic check. Unlike {@link #checkHealth(int)} a failing
     * query propagates, so the check itself reports the outage.
     */
    public QueueCounters currentCounters(int hours) {
        QueueCounters counters = outboxRepository.countQueue(hours);
        counters.setStuckLeases(outboxRepository.countStuckLeases());
        return counters;
    }

    public QueueThresholds thresholds() {
        SignalsProperties.Metering metering = properties.getMetering();
        return new QueueThresholds(metering.getQueueDepthThreshold(), metering.getDeadLetterThreshold());
    }

    private <T> CompletableFuture<T> query(String name, Supplier<T> query, T fallback) {
        return CompletableFuture.supplyAsync(query, queryExecutor)
                .exceptionally(ex -> {
                    log.error("Outbox {} query failed, reporting {}", name, fallback, ex);
                    meterRegistry.counter("signals.outbox.query.failures", "query", name).increment();
                    return fallback;
                });
    }
}
