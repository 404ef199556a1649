package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flattened error-tracker issue as it appears in list and search results
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IssueSummary {
    private String id;
    private String shortId;
    private String title;
    private String culprit;
    private String level;
    private long count;
    private long userCount;
    private String project;
    private String firstSeen;
    private String lastSeen;
    private String status;
}
