package com.company.signals.analysis;

import com.company.signals.domain.QueueCounters;
import com.company.signals.domain.QueueSnapshot;
import com.company.signals.domain.QueueThresholds;
import com.company.signals.domain.enums.CheckStatus;
import org.springframework.stereotype.Component;

/**
 * Turns outbox counters into a health verdict.
 * All four checks always run; recommendations follow the anomalies that fired.
 */
@Component
public class QueueHealthAnalyzer {

    static final String HEALTHY_RECOMMENDATION = "Outbox is healthy - all metrics normal";

    public QueueSnapshot analyze(QueueCounters counters, QueueThresholds thresholds) {
        QueueSnapshot.QueueSnapshotBuilder snapshot = QueueSnapshot.builder()
                .total(counters.getTotal())
                .pending(counters.getPending())
                .sent(counters.getSent())
                .deadLetter(counters.getDeadLetter())
                .currentlyLeased(counters.getCurrentlyLeased())
                .stuckLeases(counters.getStuckLeases());

        boolean highDepth = counters.getPending() > thresholds.getQueueDepth();
        boolean deadLetters = counters.getDeadLetter() > 0;
        boolean stuck = counters.getStuckLeases() > 0;
        boolean nothingSent = counters.getSent() == 0 && counters.getTotal() > 0;

        if (highDepth) {
            snapshot.anomaly(String.format("HIGH QUEUE DEPTH: %d pending (threshold: %d)",
                    counters.getPending(), thresholds.getQueueDepth()));
        }
        if (deadLetters) {
            snapshot.anomaly(String.format("DEAD LETTERS: %d events failed %d+ times",
                    counters.getDeadLetter(), thresholds.getDeadLetter()));
        }
        if (stuck) {
            snapshot.anomaly(String.format("STUCK LEASES: %d events with expired leases - outbox worker may be down",
                    counters.getStuckLeases()));
        }
        if (nothingSent) {
            snapshot.anomaly("NO EVENTS SENT: Events created but none delivered - check API connectivity");
        }

        if (!highDepth && !deadLetters && !stuck && !nothingSent) {
            return snapshot.recommendation(HEALTHY_RECOMMENDATION).build();
        }

        if (deadLetters) {
            snapshot.recommendation("Retry dead-letter events so the outbox worker picks them up again");
        }
        if (stuck) {
            snapshot.recommendation("Check outbox worker process - may need restart");
        }
        if (highDepth) {
            snapshot.recommendation("Consider increasing batch_size or reducing interval_ms");
        }
        return snapshot.build();
    }

    /**
     * Dead letters and stuck leases are critical, a deep queue alone only warns
     */
    public CheckStatus checkStatus(QueueCounters counters, QueueThresholds thresholds) {
        if (counters.getDeadLetter() > 0 || counters.getStuckLeases() > 0) {
            return CheckStatus.CRITICAL;
        }
        if (counters.getPending() > thresholds.getQueueDepth()) {
            return CheckStatus.WARN;
        }
        return CheckStatus.OK;
    }
}
