package com.company.signals.domain.enums;

public enum UsageAnomalyType {
    SPIKE,
    DROP,
    NONE
}
