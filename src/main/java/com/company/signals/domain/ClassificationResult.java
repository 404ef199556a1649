package com.company.signals.domain;

import lombok.Value;

import java.util.List;

@Value
public class ClassificationResult {
    String category;
    String rootCause;
    List<Suggestion> suggestions;
    List<String> relatedPatterns;
}
