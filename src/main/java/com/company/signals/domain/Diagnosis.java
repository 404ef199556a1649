package com.company.signals.domain;

import com.company.signals.domain.enums.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnosis {
    private String category;
    private Severity severity;
    private String summary;
    private String rootCause;
    private DiagnosisContext context;
    private List<Suggestion> suggestions;
    private List<String> relatedPatterns;
    private List<String> nextSteps;

    // Only present when the latest event carried breadcrumbs
    private List<Breadcrumb> breadcrumbs;

    public boolean hasSuggestion(String action) {
        return suggestions != null && suggestions.stream()
                .anyMatch(s -> action.equals(s.getAction()));
    }
}
