package com.company.signals.service;

import com.company.signals.domain.DeadLetterEvent;
import com.company.signals.domain.DeadLetterRetryResult;
import com.company.signals.domain.ErrorGroup;
import com.company.signals.repository.OutboxRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class DeadLetterService {

    public static final int DEFAULT_MAX_EVENTS = 100;

    private final OutboxRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Puts the oldest dead letters back in the queue
     *
     * @param orgId optional org filter
     */
    @Transactional
    public DeadLetterRetryResult retry(@Min(1) @Max(500) int maxEvents, String orgId) {
        List<DeadLetterEvent> events = outboxRepository.resetDeadLetters(maxEvents, orgId);
        meterRegistry.counter("signals.outbox.dead_letters.retried").increment(events.size());

        String note = events.isEmpty()
                ? "No dead-letter events found to retry."
                : "Events reset - outbox worker will pick them up on next tick.";
        return new DeadLetterRetryResult(events.size(), events, note);
    }

    /**
     * Dead letters grouped by their last error, largest groups first
     */
    public List<ErrorGroup> summarize() {
        return outboxRepository.deadLetterErrors();
    }

    public long total(List<ErrorGroup> groups) {
        return groups.stream().mapToLong(ErrorGroup::getCount).sum();
    }
}
