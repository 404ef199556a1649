package com.company.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One group of the per-org usage breakdown. Token fields are only set for LLM usage rows.
 */
@Value
@Builder
public class OrgUsage {
    String orgId;
    String provider;
    String modelFamily;
    String service;
    String feature;
    String statusBucket;
    long count;
    Long totalTokens;
    Long promptTokens;
    Long completionTokens;
    Instant firstEvent;
    Instant lastEvent;
}
