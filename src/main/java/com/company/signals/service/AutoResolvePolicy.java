package com.company.signals.service;

import com.company.signals.analysis.ErrorClassifier;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.AutoResolveDecision;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.KnownIssue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a freshly diagnosed issue may be closed without a human.
 * Critical and high severity issues never are.
 */
@Component
@RequiredArgsConstructor
public class AutoResolvePolicy {

    private final SignalsProperties properties;

    public AutoResolveDecision decide(Diagnosis diagnosis) {
        SignalsProperties.AutoResolve autoResolve = properties.getAutoResolve();
        if (!autoResolve.isEnabled()) {
            return AutoResolveDecision.none("Auto-resolve disabled in config");
        }

        String severity = diagnosis.getSeverity().label();
        if (diagnosis.getSeverity().requiresHumanReview()) {
            return AutoResolveDecision.none("Severity is " + severity + " - requires human review");
        }

        if (diagnosis.hasSuggestion(ErrorClassifier.KNOWN_BUG_ACTION) && matchesFixedKnownIssue(diagnosis)) {
            return AutoResolveDecision.resolve("Matches a known bug marked as fixed");
        }

        if (autoResolve.getCategories().contains(diagnosis.getCategory())) {
            return AutoResolveDecision.resolve("Category \"" + diagnosis.getCategory()
                    + "\" in auto-resolve list, severity is " + severity);
        }

        return AutoResolveDecision.none("Category not in auto-resolve list");
    }

    private boolean matchesFixedKnownIssue(Diagnosis diagnosis) {
        String summary = lower(diagnosis.getSummary());
        String rootCause = lower(diagnosis.getRootCause());
        for (KnownIssue issue : properties.getKnownIssues()) {
            if (!issue.isFixed() || issue.getKeywords() == null) {
                continue;
            }
            for (String keyword : issue.getKeywords()) {
                if (keyword == null || keyword.isBlank()) {
                    continue;
                }
                String kw = lower(keyword);
                if (summary.contains(kw) || rootCause.contains(kw)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
