package com.company.signals.client;

import com.company.signals.domain.Breadcrumb;
import com.company.signals.domain.ErrorRecord;
import com.company.signals.domain.IssueEvent;
import com.company.signals.domain.IssueSummary;
import com.company.signals.domain.Tag;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps Sentry issue and event JSON onto the analysis model
 */
@Component
public class SentryEventParser {

    static final int MAX_FRAMES = 15;
    static final int MAX_BREADCRUMBS = 10;

    /**
     * One {@code Type: value} line per exception followed by its innermost frames,
     * formatted as {@code   at fn (file:line[:col]) [app]}.
     */
    public List<String> extractStacktrace(JsonNode event) {
        List<String> lines = new ArrayList<>();
        for (JsonNode entry : entries(event)) {
            if (!"exception".equals(entry.path("type").asText())) {
                continue;
            }
            for (JsonNode exception : entry.path("data").path("values")) {
                lines.add(exception.path("type").asText() + ": " + exception.path("value").asText());

                JsonNode frames = exception.path("stacktrace").path("frames");
                if (!frames.isArray()) {
                    continue;
                }
                for (int i = Math.max(0, frames.size() - MAX_FRAMES); i < frames.size(); i++) {
                    lines.add(formatFrame(frames.get(i)));
                }
            }
        }
        return lines;
    }

    public List<Breadcrumb> extractBreadcrumbs(JsonNode event) {
        for (JsonNode entry : entries(event)) {
            if (!"breadcrumbs".equals(entry.path("type").asText())) {
                continue;
            }
            JsonNode values = entry.path("data").path("values");
            List<Breadcrumb> breadcrumbs = new ArrayList<>();
            for (int i = Math.max(0, values.size() - MAX_BREADCRUMBS); i < values.size(); i++) {
                JsonNode crumb = values.get(i);
                String message = crumb.hasNonNull("message")
                        ? crumb.get("message").asText()
                        : crumb.hasNonNull("data") ? crumb.get("data").toString() : "";
                breadcrumbs.add(new Breadcrumb(
                        text(crumb, "timestamp"),
                        text(crumb, "category"),
                        message));
            }
            return breadcrumbs;
        }
        return List.of();
    }

    public List<Tag> extractTags(JsonNode event) {
        List<Tag> tags = new ArrayList<>();
        if (event == null) {
            return tags;
        }
        for (JsonNode tag : event.path("tags")) {
            tags.add(new Tag(text(tag, "key"), text(tag, "value")));
        }
        return tags;
    }

    public IssueSummary toIssueSummary(JsonNode issue) {
        return IssueSummary.builder()
                .id(text(issue, "id"))
                .shortId(text(issue, "shortId"))
                .title(text(issue, "title"))
                .culprit(text(issue, "culprit"))
                .level(text(issue, "level"))
                .count(issue.path("count").asLong())
                .userCount(issue.path("userCount").asLong())
                .project(text(issue.path("project"), "slug"))
                .firstSeen(text(issue, "firstSeen"))
                .lastSeen(text(issue, "lastSeen"))
                .status(text(issue, "status"))
                .build();
    }

    /**
     * @param latestEvent may be null when the latest event could not be fetched
     */
    public ErrorRecord toErrorRecord(JsonNode issue, JsonNode latestEvent) {
        JsonNode event = latestEvent == null ? MissingNode.getInstance() : latestEvent;
        String project = text(issue.path("project"), "slug");
        String level = text(issue, "level");
        return ErrorRecord.builder()
                .title(text(issue, "title"))
                .culprit(text(issue, "culprit"))
                .level(level.isEmpty() ? "error" : level)
                .count(issue.path("count").asLong())
                .userCount(issue.path("userCount").asLong())
                .firstSeen(text(issue, "firstSeen"))
                .lastSeen(text(issue, "lastSeen"))
                .project(project.isEmpty() ? "unknown" : project)
                .tags(extractTags(event))
                .breadcrumbs(extractBreadcrumbs(event))
                .stacktrace(extractStacktrace(event))
                .build();
    }

    public IssueEvent toIssueEvent(JsonNode event) {
        List<Tag> tags = extractTags(event);
        String message = text(event, "message");
        return IssueEvent.builder()
                .eventId(text(event, "eventID"))
                .timestamp(text(event, "dateCreated"))
                .message(message.isEmpty() ? text(event, "title") : message)
                .traceId(tagValue(tags, "trace_id"))
                .runId(tagValue(tags, "run_id"))
                .service(tagValue(tags, "service"))
                .environment(tagValue(tags, "environment"))
                .release(tagValue(tags, "release"))
                .build();
    }

    private String formatFrame(JsonNode frame) {
        String filename = firstText(frame, "filename", "absPath", "unknown");
        String lineNo = firstText(frame, "lineNo", null, "?");
        String colNo = frame.hasNonNull("colNo") ? ":" + frame.get("colNo").asText() : "";
        String function = firstText(frame, "function", null, "<anonymous>");
        String inApp = frame.path("inApp").asBoolean(false) ? " [app]" : "";
        return "  at " + function + " (" + filename + ":" + lineNo + colNo + ")" + inApp;
    }

    private static Iterable<JsonNode> entries(JsonNode event) {
        return event == null ? Collections.<JsonNode>emptyList() : event.path("entries");
    }

    private static String tagValue(List<Tag> tags, String key) {
        return tags.stream()
                .filter(tag -> key.equals(tag.getKey()))
                .map(Tag::getValue)
                .findFirst()
                .orElse(null);
    }

    private static String firstText(JsonNode node, String field, String alternative, String defaultValue) {
        String value = text(node, field);
        if (value.isEmpty() && alternative != null) {
            value = text(node, alternative);
        }
        return value.isEmpty() ? defaultValue : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? "" : value.asText();
    }
}
