package com.company.signals.domain;

import com.company.signals.domain.enums.TemporalPattern;
import lombok.Value;

@Value
public class TemporalVerdict {
    TemporalPattern pattern;
    String description;

    public static TemporalVerdict unknown() {
        return new TemporalVerdict(TemporalPattern.UNKNOWN, "Not enough events to detect pattern");
    }
}
