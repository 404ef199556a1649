package com.company.signals.config;

import com.company.signals.cache.AutoResolveRateLimiter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AutoResolveRateLimiter rateLimiter;

    @Bean
    public MeterBinder signalMetrics() {
        return (registry) -> {
            Gauge.builder("signals.autoresolve.window", rateLimiter, limiter -> {
                        try {
                            return limiter.countInWindow();
                        } catch (Exception e) {
                            log.warn("Failed to read auto-resolve window", e);
                            return 0;
                        }
                    })
                    .description("Auto-resolutions performed in the last hour")
                    .register(registry);

            log.info("Signal metrics registered");
        };
    }
}
