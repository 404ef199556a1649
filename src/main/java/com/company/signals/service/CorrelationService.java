package com.company.signals.service;

import com.company.signals.analysis.CrossServiceCorrelator;
import com.company.signals.client.ErrorTrackingClient;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.CorrelationKey;
import com.company.signals.domain.CorrelationResult;
import com.company.signals.domain.ServiceIssues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Searches every watched project for a trace and/or run id and merges the hits.
 * Queries run in bounded batches; a failed query contributes no issues.
 */
@Service
@Slf4j
public class CorrelationService {

    private final ErrorTrackingClient errorTrackingClient;
    private final CrossServiceCorrelator correlator;
    private final SignalsProperties properties;
    private final Executor queryExecutor;

    public CorrelationService(ErrorTrackingClient errorTrackingClient,
                              CrossServiceCorrelator correlator,
                              SignalsProperties properties,
                              @Qualifier("signalQueryExecutor") Executor queryExecutor) {
        this.errorTrackingClient = errorTrackingClient;
        this.correlator = correlator;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
    }

    public CorrelationResult correlate(String traceId, String runId) {
        CorrelationKey key = CorrelationKey.of(traceId, runId);

        List<ProjectQuery> queries = new ArrayList<>();
        for (String project : properties.getSentry().getProjects()) {
            key.queries().forEach(query -> queries.add(new ProjectQuery(project, query)));
        }

        int batchSize = properties.getCorrelation().getBatchSize();
        List<ServiceIssues> results = new ArrayList<>();
        for (int i = 0; i < queries.size(); i += batchSize) {
            List<CompletableFuture<ServiceIssues>> batch = queries
                    .subList(i, Math.min(i + batchSize, queries.size()))
                    .stream()
                    .map(this::search)
                    .collect(Collectors.toList());

            CompletableFuture.allOf(batch.toArray(new CompletableFuture[0])).join();
            batch.forEach(future -> results.add(future.join()));
        }

        CorrelationResult result = correlator.correlate(key, results);
        log.info("Correlation trace={} run={}: {} issues across {}",
                key.getTraceId(), key.getRunId(), result.getTotalIssues(), result.getAffectedServices());
        return result;
    }

    private CompletableFuture<ServiceIssues> search(ProjectQuery query) {
        int limit = properties.getCorrelation().getIssuesPerQuery();
        return CompletableFuture
                .supplyAsync(() -> new ServiceIssues(query.project,
                        errorTrackingClient.listIssues(query.project, query.query, limit, null)), queryExecutor)
                .exceptionally(ex -> {
                    log.warn("Correlation query '{}' failed for project {}: {}",
                            query.query, query.project, ex.getMessage());
                    return ServiceIssues.empty(query.project);
                });
    }

    private static final class ProjectQuery {
        private final String project;
        private final String query;

        private ProjectQuery(String project, String query) {
            this.project = project;
            this.query = query;
        }
    }
}
