package com.company.signals.analysis;

import com.company.signals.domain.ClassificationResult;
import com.company.signals.domain.DiagnosisPattern;
import com.company.signals.domain.ErrorRecord;
import com.company.signals.domain.KnownIssue;
import com.company.signals.domain.Suggestion;
import com.company.signals.domain.enums.Confidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maps an error record to a root-cause category.
 *
 * <p>Operator patterns are tried first, in declaration order, against title, culprit
 * and stack. Only when none of them matched do the {@link BuiltInRule} families run
 * against the title. Known issues are checked last and each match is prepended to the
 * suggestion list.
 */
@Component
public class ErrorClassifier {

    public static final String FALLBACK_CATEGORY = "application_error";
    public static final String KNOWN_BUG_ACTION = "known_bug";

    public ClassificationResult classify(ErrorRecord record,
                                         List<DiagnosisPattern> patterns,
                                         List<KnownIssue> knownIssues) {
        String title = normalize(record.getTitle());
        String culprit = normalize(record.getCulprit());
        String stack = normalize(String.join("\n", record.getStacktrace()));

        String category;
        String rootCause;
        List<Suggestion> suggestions = new ArrayList<>();
        List<String> relatedPatterns = new ArrayList<>();

        Optional<DiagnosisPattern> operatorMatch = firstOperatorMatch(patterns, title, culprit, stack);
        if (operatorMatch.isPresent()) {
            DiagnosisPattern pattern = operatorMatch.get();
            category = pattern.getCategory();
            rootCause = pattern.getRootCause();
            pattern.getSuggestions().stream().map(Suggestion::copy).forEach(suggestions::add);
            relatedPatterns.addAll(pattern.getRelatedPatterns());
        } else {
            Optional<BuiltInRule> builtIn = BuiltInRule.firstMatch(title);
            if (builtIn.isPresent()) {
                BuiltInRule rule = builtIn.get();
                category = rule.getCategory();
                rootCause = rule.getRootCause();
                suggestions.addAll(rule.suggestions());
                relatedPatterns.addAll(rule.getRelatedPatterns());
            } else {
                category = FALLBACK_CATEGORY;
                rootCause = "Application error in " + (isBlank(record.getCulprit()) ? "unknown location" : record.getCulprit());
                suggestions.add(Suggestion.of("investigate", "Examine the full stack trace", Confidence.HIGH));
                suggestions.add(Suggestion.of("add_context", "Add breadcrumbs around the error", Confidence.MEDIUM));
            }
        }

        for (KnownIssue issue : knownIssues) {
            if (anyKeyword(issue.getKeywords(), kw -> title.contains(kw) || stack.contains(kw))) {
                suggestions.add(0, Suggestion.of(KNOWN_BUG_ACTION,
                        "Known bug: " + issue.getTitle() + " - " + issue.getFix(), Confidence.HIGH));
            }
        }

        return new ClassificationResult(category, rootCause, suggestions, relatedPatterns);
    }

    private Optional<DiagnosisPattern> firstOperatorMatch(List<DiagnosisPattern> patterns,
                                                          String title, String culprit, String stack) {
        for (DiagnosisPattern pattern : patterns) {
            if (anyKeyword(pattern.getKeywords(),
                    kw -> title.contains(kw) || culprit.contains(kw) || stack.contains(kw))) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Blank keywords never match, otherwise a stray empty entry in configuration would match everything.
     */
    static boolean anyKeyword(List<String> keywords, Predicate<String> contained) {
        if (keywords == null) {
            return false;
        }
        return keywords.stream()
                .filter(kw -> !isBlank(kw))
                .map(ErrorClassifier::normalize)
                .anyMatch(contained);
    }

    static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
