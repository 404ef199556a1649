package com.company.signals.domain;

import com.company.signals.domain.enums.ResolveAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AutoResolveDecision {
    boolean shouldResolve;
    String reason;
    ResolveAction action;
    Integer ignoreMinutes;

    public static AutoResolveDecision none(String reason) {
        return new AutoResolveDecision(false, reason, ResolveAction.NONE, null);
    }

    public static AutoResolveDecision resolve(String reason) {
        return new AutoResolveDecision(true, reason, ResolveAction.RESOLVE, null);
    }
}
