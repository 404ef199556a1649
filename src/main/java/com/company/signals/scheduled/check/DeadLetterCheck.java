package com.company.signals.scheduled.check;

import com.company.signals.domain.CheckResult;
import com.company.signals.domain.ErrorGroup;
import com.company.signals.domain.enums.CheckStatus;
import com.company.signals.service.DeadLetterService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class DeadLetterCheck implements PeriodicCheck {

    private final DeadLetterService deadLetterService;

    @Override
    public String name() {
        return "dead_letters";
    }

    @Override
    public CheckResult run() {
        List<ErrorGroup> groups = deadLetterService.summarize();
        long total = deadLetterService.total(groups);
        if (total > 0) {
            return new CheckResult(name(), CheckStatus.CRITICAL, total + " dead letter events need attention", groups);
        }
        return CheckResult.ok(name(), "No dead letters");
    }
}
