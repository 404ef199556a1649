package com.company.signals.scheduled;

import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.CheckResult;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.scheduled.check.PeriodicCheck;
import com.company.signals.service.NotificationSender;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured health checks on a fixed delay and notifies on anything not ok
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "signals.periodic-checks.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class PeriodicCheckJob {

    private final Map<String, PeriodicCheck> registry = new LinkedHashMap<>();
    private final SignalsProperties properties;
    private final NotificationSender notificationSender;
    private final MeterRegistry meterRegistry;

    public PeriodicCheckJob(List<PeriodicCheck> checks,
                            SignalsProperties properties,
                            NotificationSender notificationSender,
                            MeterRegistry meterRegistry) {
        checks.forEach(check -> registry.put(check.name(), check));
        this.properties = properties;
        this.notificationSender = notificationSender;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${signals.periodic-checks.interval:PT5M}", initialDelayString = "PT1M")
    public void runScheduledChecks() {
        List<CheckResult> results = runChecks();
        notificationSender.sendFailures(results);
    }

    public List<CheckResult> runChecks() {
        List<CheckResult> results = new ArrayList<>();

        for (String checkName : properties.getPeriodicChecks().getChecks()) {
            PeriodicCheck check = registry.get(checkName);
            if (check == null) {
                log.warn("Unknown check: {}", checkName);
                continue;
            }

            CheckResult result;
            try {
                result = check.run();
            } catch (Exception e) {
                log.error("Check {} failed", checkName, e);
                result = new CheckResult(checkName, CheckStatus.CRITICAL, "Check failed: " + e.getMessage(), null);
            }

            if (result.isOk()) {
                log.info("Check {}: ok", checkName);
            } else {
                log.warn("Check {}: {} - {}", checkName, result.getStatus().label(), result.getMessage());
            }
            meterRegistry.counter("signals.checks", "check", checkName, "status", result.getStatus().label()).increment();
            results.add(result);
        }

        return results;
    }
}
