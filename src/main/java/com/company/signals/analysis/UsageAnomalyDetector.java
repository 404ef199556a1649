package com.company.signals.analysis;

import com.company.signals.domain.UsageComparison;
import com.company.signals.domain.UsageRow;
import com.company.signals.domain.enums.UsageAnomalyType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags per-org token usage spikes and drops against a baseline that is already
 * scaled to the recent window length.
 */
@Component
public class UsageAnomalyDetector {

    /**
     * @return one comparison per org that had data in either window, in input order.
     *         Orgs that were not flagged carry {@link UsageAnomalyType#NONE}.
     */
    public List<UsageComparison> detect(List<UsageRow> rows, double spikeThreshold) {
        List<UsageComparison> comparisons = new ArrayList<>();
        for (UsageRow row : rows) {
            if (!hasData(row)) {
                continue;
            }
            Double tokenRatio = ratio(row.getRecentTokens(), row.getBaselineTokens());
            Double requestRatio = ratio(row.getRecentRequests(), row.getBaselineRequests());

            comparisons.add(UsageComparison.builder()
                    .orgId(row.getOrgId())
                    .recentTokens(row.getRecentTokens())
                    .recentRequests(row.getRecentRequests())
                    .baselineTokens(row.getBaselineTokens())
                    .baselineRequests(row.getBaselineRequests())
                    .tokenRatio(tokenRatio)
                    .requestRatio(requestRatio)
                    .anomalyType(classify(row, tokenRatio, spikeThreshold))
                    .build());
        }
        return comparisons;
    }

    private UsageAnomalyType classify(UsageRow row, Double tokenRatio, double spikeThreshold) {
        // absent means the org had no rows in that window, not that its totals were zero
        boolean baselineExisted = row.getBaselineTokens() != null || row.getBaselineRequests() != null;
        boolean recentAbsent = row.getRecentTokens() == null && row.getRecentRequests() == null;
        if (baselineExisted && recentAbsent) {
            return UsageAnomalyType.DROP;
        }
        if (tokenRatio != null && tokenRatio >= spikeThreshold) {
            return UsageAnomalyType.SPIKE;
        }
        return UsageAnomalyType.NONE;
    }

    /**
     * Undefined (null) without a positive baseline or without recent activity
     */
    static Double ratio(Double recent, Double baseline) {
        if (recent == null || !positive(baseline)) {
            return null;
        }
        return BigDecimal.valueOf(recent / baseline).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean hasData(UsageRow row) {
        return row.getRecentTokens() != null || row.getRecentRequests() != null
                || row.getBaselineTokens() != null || row.getBaselineRequests() != null;
    }

    private static boolean positive(Double value) {
        return value != null && value > 0;
    }
}
