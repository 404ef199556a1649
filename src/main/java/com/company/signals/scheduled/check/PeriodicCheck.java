package com.company.signals.scheduled.check;

import com.company.signals.domain.CheckResult;

/**
 * One named periodic health check. Implementations may throw; the job turns a
 * thrown exception into a critical result.
 */
public interface PeriodicCheck {

    String name();

    CheckResult run();
}
