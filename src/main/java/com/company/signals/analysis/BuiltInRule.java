package com.company.signals.analysis;

import com.company.signals.domain.Suggestion;
import com.company.signals.domain.enums.Confidence;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fallback classification families, in priority order.
 * Keywords are matched against the lowercased issue title only.
 */
public enum BuiltInRule {

    NETWORK_ERROR("network_error",
            "External service unreachable or network issue",
            List.of("fetch failed", "econnrefused", "enotfound", "econnreset", "network"),
            List.of(
                    Suggestion.of("check_provider", "Check upstream provider health", Confidence.HIGH),
                    Suggestion.of("add_retry", "Add retry with exponential backoff", Confidence.MEDIUM),
                    Suggestion.of("add_circuit_breaker", "Implement circuit breaker", Confidence.MEDIUM)),
            List.of("Provider outage", "DNS failure", "Connection pool exhaustion")),

    TIMEOUT("timeout",
            "Operation exceeded time limit",
            List.of("timeout", "aborterror", "abort", "deadline"),
            List.of(
                    Suggestion.of("use_streaming", "Switch to streaming for long operations", Confidence.HIGH),
                    Suggestion.of("check_pool", "Check connection pool utilization", Confidence.MEDIUM),
                    Suggestion.of("review_timeout", "Review timeout values", Confidence.MEDIUM)),
            List.of("Slow response", "Pool exhaustion", "Resource contention")),

    AUTH_ERROR("auth_error",
            "Authentication or authorization failure",
            List.of("unauthorized", "401", "403", "forbidden", "auth"),
            List.of(
                    Suggestion.of("rotate_keys", "Check if API keys have expired", Confidence.HIGH),
                    Suggestion.of("check_config", "Verify auth configuration", Confidence.HIGH)),
            List.of("Key rotation", "Tenant misconfiguration", "CORS")),

    RATE_LIMIT("rate_limit",
            "Rate limit or quota exceeded",
            List.of("rate", "429", "quota", "too many"),
            List.of(
                    Suggestion.of("check_quotas", "Review quota/rate limit settings", Confidence.HIGH),
                    Suggestion.of("add_queuing", "Add request queuing", Confidence.MEDIUM)),
            List.of("Provider rate limit", "Quota exceeded", "Burst traffic")),

    DATABASE_ERROR("database_error",
            "Database connectivity or query issue",
            List.of("database", "postgres", "unique constraint", "deadlock", "connection"),
            List.of(
                    Suggestion.of("check_db", "Verify database connectivity", Confidence.HIGH),
                    Suggestion.of("check_pool", "Review connection pool config", Confidence.MEDIUM),
                    Suggestion.of("check_migrations", "Ensure migrations are applied", Confidence.MEDIUM)),
            List.of("Pool exhaustion", "Missing migration", "Lock contention")),

    VALIDATION_ERROR("validation_error",
            "Request payload failed schema validation",
            List.of("validation", "zod", "parse", "schema"),
            List.of(
                    Suggestion.of("check_schema", "Review API schema", Confidence.HIGH),
                    Suggestion.of("add_error_detail", "Return validation errors in API response", Confidence.HIGH)),
            List.of("Schema mismatch", "Client update needed", "Missing field")),

    MEMORY_LEAK("memory_leak",
            "Memory limit exceeded",
            List.of("heap", "out of memory", "oom"),
            List.of(
                    Suggestion.of("check_heap", "Take heap snapshot", Confidence.HIGH),
                    Suggestion.of("check_streams", "Verify streams are closed", Confidence.MEDIUM)),
            List.of("Unbounded cache", "Event listener leak", "Large payload"));

    private final String category;
    private final String rootCause;
    private final List<String> keywords;
    private final List<Suggestion> suggestions;
    private final List<String> relatedPatterns;

    BuiltInRule(String category, String rootCause, List<String> keywords,
                List<Suggestion> suggestions, List<String> relatedPatterns) {
        this.category = category;
        this.rootCause = rootCause;
        this.keywords = keywords;
        this.suggestions = suggestions;
        this.relatedPatterns = relatedPatterns;
    }

    public String getCategory() {
        return category;
    }

    public String getRootCause() {
        return rootCause;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * Fresh copies, callers may mutate the returned suggestions
     */
    public List<Suggestion> suggestions() {
        return suggestions.stream().map(Suggestion::copy).collect(Collectors.toList());
    }

    public List<String> getRelatedPatterns() {
        return relatedPatterns;
    }

    public boolean matches(String normalizedTitle) {
        return keywords.stream().anyMatch(normalizedTitle::contains);
    }

    public static Optional<BuiltInRule> firstMatch(String normalizedTitle) {
        return Arrays.stream(values())
                .filter(rule -> rule.matches(normalizedTitle))
                .findFirst();
    }
}
