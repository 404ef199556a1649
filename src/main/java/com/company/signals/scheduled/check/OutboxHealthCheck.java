package com.company.signals.scheduled.check;

import com.company.signals.analysis.QueueHealthAnalyzer;
import com.company.signals.domain.CheckResult;
import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.QueueThresholds;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.service.OutboxHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class OutboxHealthCheck implements PeriodicCheck {

    static final int LOOKBACK_HOURS = 1;

    private final OutboxHealthService outboxHealthService;
    private final QueueHealthAnalyzer analyzer;

    @Override
    public String name() {
        return "outbox_health";
    }

    @Override
    public CheckResult run() {
        QueueCounters counters = outboxHealthService.currentCounters(LOOKBACK_HOURS);
        QueueThresholds thresholds = outboxHealthService.thresholds();
        CheckStatus status = analyzer.checkStatus(counters, thresholds);

        Map<String, Long> details = new LinkedHashMap<>();
        details.put("pending", counters.getPending());
        details.put("deadLetter", counters.getDeadLetter());
        details.put("stuck", counters.getStuckLeases());

        if (status == CheckStatus.OK) {
            return new CheckResult(name(), status,
                    "Healthy: " + counters.getPending() + " pending, 0 dead letters", details);
        }

        List<String> problems = new ArrayList<>();
        if (counters.getPending() > thresholds.getQueueDepth()) {
            problems.add(counters.getPending() + " pending (threshold: " + thresholds.getQueueDepth() + ")");
        }
        if (counters.getDeadLetter() > 0) {
            problems.add(counters.getDeadLetter() + " dead letters");
        }
        if (counters.getStuckLeases() > 0) {
            problems.add(counters.getStuckLeases() + " stuck leases");
        }
        return new CheckResult(name(), status, String.join("; ", problems), details);
    }
}
