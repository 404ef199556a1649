package com.company.signals.config;

import com.company.signals.domain.DiagnosisPattern;
import com.company.signals.domain.KnownIssue;
import com.company.signals.domain.Runbook;
import com.company.signals.domain.ServiceInfo;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signal analysis configuration.
 * <p>
 * Bound from {@code application.yml}; an operator file can be layered on top with
 * {@code spring.config.import}. Covers:
 * <ul>
 *     <li>error tracker access and watched projects</li>
 *     <li>service topology, diagnosis patterns, known issues and runbooks</li>
 *     <li>metering outbox thresholds</li>
 *     <li>webhook triage, auto-resolve policy and periodic checks</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "signals")
public class SignalsProperties {

    @Valid
    private final Sentry sentry = new Sentry();
    @Valid
    private final Metering metering = new Metering();
    @Valid
    private final Correlation correlation = new Correlation();
    private final Webhook webhook = new Webhook();
    @Valid
    private final AutoResolve autoResolve = new AutoResolve();
    private final PeriodicChecks periodicChecks = new PeriodicChecks();

    /** Service name to repo/runtime/framework */
    private Map<String, ServiceInfo> services = new LinkedHashMap<>();

    /** Tried in declaration order, first match wins */
    private List<DiagnosisPattern> diagnosisPatterns = new ArrayList<>();

    private List<KnownIssue> knownIssues = new ArrayList<>();

    /** Category to runbook */
    private Map<String, Runbook> runbooks = new LinkedHashMap<>();

    @Data
    public static class Sentry {
        @NotBlank
        private String baseUrl = "https://sentry.io/api/0";
        private String org;
        private String authToken;
        private List<String> projects = new ArrayList<>();
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Metering {
        @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?",
                message = "outbox table must be a plain SQL identifier")
        private String outboxTable = "openmeter_event_ledger";

        /** Attempts after which an outbox row counts as dead */
        @Min(1)
        private int deadLetterThreshold = 10;

        @Min(1)
        private long queueDepthThreshold = 500;

        private double spikeThreshold = 3.0;
        private int recentHours = 24;
        private int baselineHours = 168;
    }

    @Data
    public static class Correlation {
        /** Concurrent error-tracker queries per batch */
        @Min(1)
        private int batchSize = 6;
        private int issuesPerQuery = 10;
    }

    @Data
    public static class Webhook {
        /** HMAC secret for sentry-hook-signature, verification is skipped when blank */
        private String sentrySecret;
    }

    @Data
    public static class AutoResolve {
        private boolean enabled = false;
        private List<String> categories = new ArrayList<>();
        @Min(0)
        private int maxAutoResolvePerHour = 10;
    }

    @Data
    public static class PeriodicChecks {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
        private List<String> checks = new ArrayList<>(List.of("outbox_health", "error_spike", "dead_letters"));
        private String notifyUrl;
        /** Issue count above which an unresolved issue counts as a spike */
        private long errorSpikeCount = 100;
    }
}
