package com.company.signals.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TemporalPattern {
    BURST,
    STEADY,
    REGRESSION,
    SPORADIC,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
