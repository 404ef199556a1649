package com.company.signals.analysis;

import com.company.signals.domain.ClassificationResult;
import com.company.signals.domain.Diagnosis;
import com.company.signals.domain.DiagnosisContext;
import com.company.signals.domain.DiagnosisPattern;
import com.company.signals.domain.ErrorRecord;
import com.company.signals.domain.KnownIssue;
import com.company.signals.domain.ServiceInfo;
import com.company.signals.domain.enums.Severity;
import com.company.signals.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines classification, severity and service topology into a {@link Diagnosis}
 */
@Component
@RequiredArgsConstructor
public class DiagnosisComposer {

    private static final String UNKNOWN = "unknown";
    private static final double MILLIS_PER_DAY = 1000.0 * 60 * 60 * 24;

    private final ErrorClassifier classifier;
    private final SeverityScorer severityScorer;
    private final Clock clock;

    public Diagnosis compose(ErrorRecord record,
                             List<DiagnosisPattern> patterns,
                             List<KnownIssue> knownIssues,
                             Map<String, ServiceInfo> serviceTopology) {
        ClassificationResult classification = classifier.classify(record, patterns, knownIssues);
        Severity severity = severityScorer.score(
                record.getLevel(), record.getCount(), record.getUserCount(), record.getLastSeen());
        boolean recent = severityScorer.isRecent(record.getLastSeen());

        String service = record.tagValue("service")
                .filter(value -> !value.isBlank())
                .orElse(isBlank(record.getProject()) ? UNKNOWN : record.getProject());
        ServiceInfo info = serviceTopology == null ? null : serviceTopology.get(service);

        DiagnosisContext context = DiagnosisContext.builder()
                .service(service)
                .repo(info == null ? UNKNOWN : orUnknown(info.getRepo()))
                .runtime(info == null ? UNKNOWN : orUnknown(info.getRuntime()))
                .framework(info == null ? UNKNOWN : orUnknown(info.getFramework()))
                .environment(record.tagValue("environment").filter(v -> !v.isBlank()).orElse(UNKNOWN))
                .eventCount(record.getCount())
                .userCount(record.getUserCount())
                .age(formatAge(record.getFirstSeen()))
                .recent(recent)
                .lastActive(recent ? "within last hour" : record.getLastSeen())
                .build();

        String category = classification.getCategory();
        List<String> nextSteps = new ArrayList<>();
        nextSteps.add("Run: cross_correlate with trace_id to check cascade");
        nextSteps.add("Run: generate_runbook with category=\"" + category + "\"");
        nextSteps.add(severity.requiresHumanReview()
                ? "URGENT: Follow runbook mitigation steps"
                : "Monitor frequency trend");

        return Diagnosis.builder()
                .category(category)
                .severity(severity)
                .summary("[" + severity.name() + "] " + category + ": " + nullToEmpty(record.getTitle()))
                .rootCause(classification.getRootCause())
                .context(context)
                .suggestions(classification.getSuggestions())
                .relatedPatterns(classification.getRelatedPatterns())
                .nextSteps(nextSteps)
                .breadcrumbs(record.getBreadcrumbs().isEmpty() ? null : record.getBreadcrumbs())
                .build();
    }

    String formatAge(String firstSeen) {
        return TimeUtils.parseTimestamp(firstSeen)
                .map(seen -> Duration.between(seen, clock.instant()).toMillis() / MILLIS_PER_DAY)
                .map(days -> String.format(Locale.ROOT, "%.1f days", days))
                .orElse(UNKNOWN);
    }

    private static String orUnknown(String value) {
        return isBlank(value) ? UNKNOWN : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
