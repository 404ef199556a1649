package com.company.signals.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for outbound fan-out (error-tracker searches, outbox aggregates)
 */
@Configuration
@RequiredArgsConstructor
public class ConcurrencyConfig {

    private final SignalsProperties properties;

    @Bean(name = "signalQueryExecutor")
    public ThreadPoolTaskExecutor signalQueryExecutor() {
        int batchSize = properties.getCorrelation().getBatchSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchSize);
        executor.setMaxPoolSize(batchSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("signal-query-");
        // rejected queries run on the submitting thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
