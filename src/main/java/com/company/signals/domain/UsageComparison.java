package com.company.signals.domain;

import com.company.signals.domain.enums.UsageAnomalyType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UsageComparison {
    String orgId;
    Double recentTokens;
    Double recentRequests;
    Double baselineTokens;
    Double baselineRequests;
    Double tokenRatio;      // null when there is no baseline
    Double requestRatio;
    UsageAnomalyType anomalyType;

    public boolean isFlagged() {
        return anomalyType != UsageAnomalyType.NONE;
    }

    public String describe() {
        switch (anomalyType) {
            case DROP:
                return "DROP (no recent usage)";
            case SPIKE:
                return "SPIKE (" + tokenRatio + "x baseline)";
            default:
                return "normal";
        }
    }
}
