package com.company.signals.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * One error-tracker issue as seen by the classifier.
 * Timestamps are kept exactly as the tracker sent them; parsing happens at scoring time.
 */
@Value
@Builder
public class ErrorRecord {
    String title;
    String culprit;
    String level;        // fatal, error, warning, info
    long count;
    long userCount;
    String firstSeen;
    String lastSeen;
    String project;

    @Singular
    List<Tag> tags;

    @Singular
    List<Breadcrumb> breadcrumbs;

    @Singular("stackLine")
    List<String> stacktrace;

    public Optional<String> tagValue(String key) {
        return tags.stream()
                .filter(tag -> key.equals(tag.getKey()))
                .map(Tag::getValue)
                .findFirst();
    }
}
