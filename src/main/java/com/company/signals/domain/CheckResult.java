package com.company.signals.domain;

import com.company.signals.domain.enums.CheckStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckResult {
    String check;
    CheckStatus status;
    String message;
    Object details;

    public static CheckResult ok(String check, String message) {
        return new CheckResult(check, CheckStatus.OK, message, null);
    }

    public boolean isOk() {
        return status == CheckStatus.OK;
    }
}
