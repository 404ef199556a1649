package com.company.signals.dto.response;

import com.company.signals.domain.AutoResolveDecision;
import com.company.signals.domain.Runbook;
import com.company.signals.domain.enums.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriageResponse {

    public static final String SKIPPED = "skipped";
    public static final String TRIAGED = "triaged";
    public static final String AUTO_RESOLVED = "auto_resolved";

    private boolean accepted;
    private String action;
    private String reason;
    private String issueId;
    private String category;
    private Severity severity;
    private String diagnosis;
    private AutoResolveDecision autoResolve;
    private Runbook runbook;

    public static TriageResponse skipped(String reason) {
        return TriageResponse.builder()
                .accepted(true)
                .action(SKIPPED)
                .reason(reason)
                .build();
    }
}
