package com.company.signals.client;

import com.company.signals.config.RedisCacheConfig;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.IssueSummary;
import com.company.signals.domain.enums.ResolveAction;
import com.company.signals.exception.ErrorTrackingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentry REST API client. Every path is scoped to the configured organization.
 */
@Slf4j
@Component
public class SentryClient implements ErrorTrackingClient {

    private final RestClient restClient;
    private final SignalsProperties.Sentry sentry;
    private final SentryEventParser parser;

    public SentryClient(RestClient.Builder restClientBuilder,
                        SignalsProperties properties,
                        SentryEventParser parser) {
        this.sentry = properties.getSentry();
        this.parser = parser;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(sentry.getConnectTimeout());
        requestFactory.setReadTimeout(sentry.getReadTimeout());

        this.restClient = restClientBuilder
                .baseUrl(sentry.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    @Cacheable(value = RedisCacheConfig.PROJECT_ISSUES_CACHE,
            key = "#project + ':' + #query + ':' + #limit + ':' + #sort")
    @CircuitBreaker(name = "sentry", fallbackMethod = "listIssuesFallback")
    public List<IssueSummary> listIssues(String project, String query, int limit, String sort) {
        log.debug("Listing issues: project={}, query={}, limit={}", project, query, limit);

        JsonNode issues = restClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/organizations/{org}/issues/")
                            .queryParam("project", project)
                            .queryParam("query", query)
                            .queryParam("limit", limit);
                    if (sort != null) {
                        uriBuilder.queryParam("sort", sort);
                    }
                    return uriBuilder.build(org());
                })
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(JsonNode.class);

        List<IssueSummary> summaries = new ArrayList<>();
        if (issues != null) {
            issues.forEach(issue -> summaries.add(parser.toIssueSummary(issue)));
        }
        return summaries;
    }

    @Override
    @CircuitBreaker(name = "sentry", fallbackMethod = "getIssueFallback")
    public JsonNode getIssue(String issueId) {
        return get("/organizations/{org}/issues/{id}/", issueId);
    }

    @Override
    @CircuitBreaker(name = "sentry", fallbackMethod = "getIssueFallback")
    public JsonNode getLatestEvent(String issueId) {
        return get("/organizations/{org}/issues/{id}/events/latest/", issueId);
    }

    @Override
    @CircuitBreaker(name = "sentry", fallbackMethod = "getIssueEventsFallback")
    public JsonNode getIssueEvents(String issueId, int limit) {
        log.debug("Fetching {} events for issue {}", limit, issueId);
        return restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/organizations/{org}/issues/{id}/events/")
                        .queryParam("limit", limit)
                        .build(org(), issueId))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(JsonNode.class);
    }

    @Override
    @CircuitBreaker(name = "sentry", fallbackMethod = "updateStatusFallback")
    public JsonNode updateStatus(String issueId, ResolveAction action, Integer ignoreMinutes) {
        if (action == null || action.getTrackerStatus() == null) {
            throw new IllegalArgumentException("No tracker status for action " + action);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("status", action.getTrackerStatus());
        if (action == ResolveAction.IGNORE && ignoreMinutes != null) {
            body.put("statusDetails", Map.of("ignoreDuration", ignoreMinutes));
        }

        log.info("Updating issue {} to {}", issueId, action.getTrackerStatus());
        return restClient.put()
                .uri("/organizations/{org}/issues/{id}/", org(), issueId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .body(body)
                .retrieve()
                .body(JsonNode.class);
    }

    public List<IssueSummary> listIssuesFallback(String project, String query, int limit, String sort,
                                                 Throwable throwable) {
        throw failure("list issues for project " + project, throwable);
    }

    public JsonNode getIssueFallback(String issueId, Throwable throwable) {
        throw failure("fetch issue " + issueId, throwable);
    }

    public JsonNode getIssueEventsFallback(String issueId, int limit, Throwable throwable) {
        throw failure("fetch events for issue " + issueId, throwable);
    }

    public JsonNode updateStatusFallback(String issueId, ResolveAction action, Integer ignoreMinutes,
                                         Throwable throwable) {
        if (throwable instanceof IllegalArgumentException) {
            throw (IllegalArgumentException) throwable;
        }
        throw failure("update status of issue " + issueId, throwable);
    }

    private JsonNode get(String path, String issueId) {
        return restClient.get()
                .uri(path, org(), issueId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(JsonNode.class);
    }

    private ErrorTrackingException failure(String operation, Throwable throwable) {
        if (throwable instanceof ErrorTrackingException) {
            return (ErrorTrackingException) throwable;
        }
        log.warn("Sentry unavailable, could not {}: {}", operation, throwable.getMessage());
        return new ErrorTrackingException("Sentry request failed: could not " + operation, throwable);
    }

    private String org() {
        if (sentry.getOrg() == null || sentry.getOrg().isBlank()) {
            throw new ErrorTrackingException("Sentry organization not configured (signals.sentry.org)");
        }
        return sentry.getOrg();
    }

    private String bearer() {
        if (sentry.getAuthToken() == null || sentry.getAuthToken().isBlank()) {
            throw new ErrorTrackingException("Sentry auth token not configured (signals.sentry.auth-token)");
        }
        return "Bearer " + sentry.getAuthToken();
    }
}
