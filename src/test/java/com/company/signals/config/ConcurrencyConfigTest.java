package com.company.signals.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyConfigTest {

    private ThreadPoolTaskExecutor executor;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        SignalsProperties properties = new SignalsProperties();
        properties.getCorrelation().setBatchSize(1);
        executor = new ConcurrencyConfig(properties).signalQueryExecutor();
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    void saturatedPoolRunsQueryOnCaller() {
        executor.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int i = 0; i < 100; i++) {
            executor.execute(() -> { });
        }

        AtomicReference<Thread> ranOn = new AtomicReference<>();
        executor.execute(() -> ranOn.set(Thread.currentThread()));

        assertThat(ranOn.get()).isSameAs(Thread.currentThread());
    }
}
