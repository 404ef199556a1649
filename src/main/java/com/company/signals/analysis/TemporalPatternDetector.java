package com.company.signals.analysis;

import com.company.signals.domain.TemporalVerdict;
import com.company.signals.domain.enums.TemporalPattern;
import com.company.signals.exception.InvalidTimestampException;
import com.company.signals.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Classifies the shape of an event series from its timestamps.
 * Rules are tried in order: burst, steady, regression, then sporadic as the catch-all.
 */
@Component
public class TemporalPatternDetector {

    static final double BURST_WINDOW_FRACTION = 0.2;
    static final double BURST_EVENT_FRACTION = 0.8;
    static final double BURST_MIN_SPAN_HOURS = 1.0;
    static final double STEADY_MAX_CV = 0.5;
    static final int STEADY_MIN_EVENTS = 5;
    static final double REGRESSION_GAP_FACTOR = 5.0;
    static final int REGRESSION_MIN_EVENTS = 3;

    private static final double MILLIS_PER_HOUR = 1000.0 * 60 * 60;

    public TemporalVerdict classify(List<String> timestamps) {
        if (timestamps == null || timestamps.size() < 2) {
            return TemporalVerdict.unknown();
        }

        long[] times = timestamps.stream()
                .mapToLong(this::toEpochMillis)
                .sorted()
                .toArray();
        reverse(times);

        int n = times.length;
        double[] gaps = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            gaps[i] = times[i] - times[i + 1];
        }

        double avgGap = Arrays.stream(gaps).average().orElse(0);
        double variance = Arrays.stream(gaps)
                .map(gap -> Math.pow(gap - avgGap, 2))
                .sum() / gaps.length;

        long earliest = times[n - 1];
        long spanMs = times[0] - earliest;
        double spanHours = spanMs / MILLIS_PER_HOUR;

        double burstMark = earliest + spanMs * BURST_WINDOW_FRACTION;
        long inBurstWindow = Arrays.stream(times).filter(t -> t <= burstMark).count();
        if ((double) inBurstWindow / n > BURST_EVENT_FRACTION && spanHours > BURST_MIN_SPAN_HOURS) {
            return new TemporalVerdict(TemporalPattern.BURST,
                    String.format("Burst: %d of %d events in a concentrated window", inBurstWindow, n));
        }

        // NaN when every event shares one timestamp, which fails the comparison below
        double cv = Math.sqrt(variance) / avgGap;
        if (cv < STEADY_MAX_CV && n >= STEADY_MIN_EVENTS) {
            return new TemporalVerdict(TemporalPattern.STEADY,
                    String.format(Locale.ROOT, "Steady: ~%ds between events (CV=%.2f)",
                            Math.round(avgGap / 1000), cv));
        }

        double maxGap = Arrays.stream(gaps).max().orElse(0);
        if (maxGap > avgGap * REGRESSION_GAP_FACTOR && n >= REGRESSION_MIN_EVENTS) {
            return new TemporalVerdict(TemporalPattern.REGRESSION,
                    String.format("Regression: long gap of %dmin then new cluster",
                            Math.round(maxGap / 1000 / 60)));
        }

        return new TemporalVerdict(TemporalPattern.SPORADIC,
                String.format(Locale.ROOT, "Sporadic: %d events over %.1fh with irregular intervals", n, spanHours));
    }

    private long toEpochMillis(String timestamp) {
        return TimeUtils.parseTimestamp(timestamp)
                .orElseThrow(() -> new InvalidTimestampException(timestamp))
                .toEpochMilli();
    }

    private static void reverse(long[] values) {
        for (int i = 0, j = values.length - 1; i < j; i++, j--) {
            long tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
