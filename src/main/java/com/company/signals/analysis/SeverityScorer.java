package com.company.signals.analysis;

import com.company.signals.domain.enums.Severity;
import com.company.signals.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Component
@RequiredArgsConstructor
public class SeverityScorer {

    /** An issue seen within this window counts as currently active */
    public static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private final Clock clock;

    /**
     * First matching rule wins:
     * critical for fatal, very high volume, or high volume that is still active;
     * high for errors with high volume or many affected users;
     * medium for errors with moderate volume; low otherwise.
     */
    public Severity score(String level, long count, long userCount, String lastSeen) {
        boolean recent = isRecent(lastSeen);
        boolean error = "error".equalsIgnoreCase(level);

        if ("fatal".equalsIgnoreCase(level) || count > 1000 || (count > 100 && recent)) {
            return Severity.CRITICAL;
        }
        if (error && (count > 100 || userCount > 10)) {
            return Severity.HIGH;
        }
        if (error && count > 10) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    /**
     * Unparsable timestamps are never recent
     */
    public boolean isRecent(String lastSeen) {
        Instant now = clock.instant();
        return TimeUtils.parseTimestamp(lastSeen)
                .map(seen -> Duration.between(seen, now).compareTo(RECENT_WINDOW) < 0)
                .orElse(false);
    }
}
