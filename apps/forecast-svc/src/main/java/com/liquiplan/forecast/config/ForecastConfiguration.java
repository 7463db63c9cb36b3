package com.liquiplan.forecast.config;

import com.liquiplan.forecast.forecast.AccountCategorizer;
import com.liquiplan.forecast.forecast.AccountCategoryTable;
import com.liquiplan.forecast.forecast.ForecastSettings;
import com.liquiplan.forecast.forecast.RangeTableAccountCategorizer;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ForecastConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ForecastConfiguration.class);
    private static final int NARRATIVE_THREADS = 2;
    static final int NARRATIVE_QUEUE_CAPACITY = 16;

    @Bean
    public ForecastSettings forecastSettings(LiquiplanProperties properties) {
        ForecastSettings settings = properties.forecast().applyTo(ForecastSettings.defaults());
        log.info("Forecast: defaultThreshold={} defaultWeeks={} payrollWindow={}-{} rentWindow={}-{}",
                settings.defaultThreshold(), settings.defaultWeeks(),
                settings.payrollWindow().firstDay(), settings.payrollWindow().lastDay(),
                settings.rentWindow().firstDay(), settings.rentWindow().lastDay());
        return settings;
    }

    @Bean
    public AccountCategorizer accountCategorizer(LiquiplanProperties properties) {
        AccountCategoryTable table = properties.categories().toTable();
        log.info("Forecast: {} account ranges, expense boundary {}", table.ranges().size(), table.expenseBoundary());
        return new RangeTableAccountCategorizer(table);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService narrativeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        // full queue rejects instead of piling up requests behind a slow model endpoint
        return new ThreadPoolExecutor(
                NARRATIVE_THREADS,
                NARRATIVE_THREADS,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(NARRATIVE_QUEUE_CAPACITY),
                runnable -> {
                    Thread thread = new Thread(runnable, "narrative-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
