package com.company.signals.domain;

import com.company.signals.exception.MissingCorrelationKeyException;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class CorrelationKey {
    String traceId;
    String runId;

    public static CorrelationKey of(String traceId, String runId) {
        String trace = blankToNull(traceId);
        String run = blankToNull(runId);
        if (trace == null && run == null) {
            throw new MissingCorrelationKeyException("Provide at least one of traceId or runId");
        }
        return new CorrelationKey(trace, run);
    }

    /**
     * Error-tracker search queries for this key, trace first
     */
    public List<String> queries() {
        List<String> queries = new ArrayList<>(2);
        if (traceId != null) {
            queries.add("trace_id:" + traceId);
        }
        if (runId != null) {
            queries.add("run_id:" + runId);
        }
        return queries;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
