package com.company.signals.scheduled.check;

import com.company.signals.domain.CheckResult;
import com.company.signals.domain.UsageReport;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.service.UsageAnomalyService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class UsageAnomalyCheck implements PeriodicCheck {

    private final UsageAnomalyService usageAnomalyService;

    @Override
    public String name() {
        return "usage_anomaly";
    }

    @Override
    public CheckResult run() {
        UsageReport report = usageAnomalyService.detectAnomalies();
        if (report.getAnomaliesFound() == 0) {
            return CheckResult.ok(name(), "No usage anomalies (" + report.getTimeRange() + ")");
        }
        String orgs = report.getAnomalies().stream()
                .map(anomaly -> anomaly.getOrgId() + " " + anomaly.describe())
                .collect(Collectors.joining(", "));
        return new CheckResult(name(), CheckStatus.WARN,
                report.getAnomaliesFound() + " usage anomalies: " + orgs, report.getAnomalies());
    }
}
