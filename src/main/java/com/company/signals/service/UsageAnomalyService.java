package com.company.signals.service;

import com.company.signals.analysis.UsageAnomalyDetector;
import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.OrgUsage;
import com.company.signals.domain.UsageBreakdown;
import com.company.signals.domain.UsageComparison;
import com.company.signals.domain.UsageReport;
import com.company.signals.domain.UsageRow;
import com.company.signals.repository.OutboxRepository;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class UsageAnomalyService {

    private final OutboxRepository outboxRepository;
    private final UsageAnomalyDetector detector;
    private final SignalsProperties properties;

    public UsageReport detectAnomalies() {
        SignalsProperties.Metering metering = properties.getMetering();
        return detectAnomalies(metering.getRecentHours(), metering.getBaselineHours(), metering.getSpikeThreshold());
    }

    public UsageReport detectAnomalies(@Min(1) @Max(168) int hours,
                                       @Min(24) @Max(720) int baselineHours,
                                       @DecimalMin("1.0") double spikeThreshold) {
        List<UsageRow> rows = outboxRepository.usageComparison(hours, baselineHours);
        List<UsageComparison> allOrgs = detector.detect(rows, spikeThreshold);
        List<UsageComparison> anomalies = allOrgs.stream()
                .filter(UsageComparison::isFlagged)
                .collect(Collectors.toList());

        if (!anomalies.isEmpty()) {
            log.warn("{} usage anomalies in last {}h vs {}h baseline", anomalies.size(), hours, baselineHours);
        }

        return UsageReport.builder()
                .timeRange("Recent " + hours + "h vs baseline " + baselineHours + "h")
                .spikeThreshold(spikeThreshold)
                .anomalies(anomalies)
                .allOrgs(allOrgs)
                .build();
    }

    /**
     * @param orgId optional, null for every org
     */
    public UsageBreakdown usageByOrg(@Min(1) @Max(720) int hours, String orgId) {
        List<OrgUsage> llmUsage = outboxRepository.llmUsage(hours, orgId);
        List<OrgUsage> otherUsage = outboxRepository.otherUsage(hours, orgId);
        return new UsageBreakdown("Last " + hours + " hours", orgId == null ? "all" : orgId, llmUsage, otherUsage);
    }
}
