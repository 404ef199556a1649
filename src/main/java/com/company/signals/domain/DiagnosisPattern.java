package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-supplied classification rule, bound from configuration.
 * Patterns are tried in declaration order and the first keyword hit wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosisPattern {
    private String category;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String rootCause;

    @Builder.Default
    private List<Suggestion> suggestions = new ArrayList<>();

    @Builder.Default
    private List<String> relatedPatterns = new ArrayList<>();
}
