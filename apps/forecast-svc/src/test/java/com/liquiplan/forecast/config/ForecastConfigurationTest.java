package com.liquiplan.forecast.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastConfigurationTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = new ForecastConfiguration().narrativeExecutor();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void narrativeExecutorQueueIsBounded() {
        assertThat(executor).isInstanceOf(ThreadPoolExecutor.class);
        assertThat(((ThreadPoolExecutor) executor).getQueue().remainingCapacity())
                .isEqualTo(ForecastConfiguration.NARRATIVE_QUEUE_CAPACITY);
    }

    @Test
    void saturatedExecutorRejectsNewWork() {
        ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
        int capacity = pool.getMaximumPoolSize() + ForecastConfiguration.NARRATIVE_QUEUE_CAPACITY;
        for (int i = 0; i < capacity; i++) {
            executor.submit(this::awaitRelease);
        }

        assertThatThrownBy(() -> executor.submit(this::awaitRelease))
                .isInstanceOf(RejectedExecutionException.class);
    }

    private void awaitRelease() {
        try {
            release.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
