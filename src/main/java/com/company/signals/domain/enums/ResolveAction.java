package com.company.signals.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status transitions accepted by the error tracker
 */
public enum ResolveAction {
    RESOLVE("resolved"),
    IGNORE("ignored"),
    UNRESOLVE("unresolved"),
    NONE(null);

    private final String trackerStatus;

    ResolveAction(String trackerStatus) {
        this.trackerStatus = trackerStatus;
    }

    public String getTrackerStatus() {
        return trackerStatus;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
