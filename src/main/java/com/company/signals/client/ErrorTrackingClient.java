package com.company.signals.client;

import com.company.signals.domain.IssueSummary;
import com.company.signals.domain.enums.ResolveAction;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Read and status-mutation access to the error tracker.
 * Implementations raise {@link com.company.signals.exception.ErrorTrackingException} on failure.
 */
public interface ErrorTrackingClient {

    List<IssueSummary> listIssues(String project, String query, int limit, String sort);

    JsonNode getIssue(String issueId);

    JsonNode getLatestEvent(String issueId);

    JsonNode getIssueEvents(String issueId, int limit);

    /**
     * @param ignoreMinutes only used with {@link ResolveAction#IGNORE}; null ignores forever
     */
    JsonNode updateStatus(String issueId, ResolveAction action, Integer ignoreMinutes);
}
