package com.liquiplan.forecast.ai;

import com.liquiplan.forecast.config.LiquiplanProperties;
import com.liquiplan.forecast.forecast.Money;
import com.liquiplan.forecast.model.LiquidityAlert;
import com.liquiplan.forecast.model.LiquidityForecast;
import com.liquiplan.forecast.model.LiquidityKpis;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Adds a short management summary on top of a finished forecast. The deterministic forecast is the
 * source of truth; when the model is unavailable, slow or failing the caller simply gets no narrative.
 */
@Service
public class ForecastNarrativeService {

    private static final Logger log = LoggerFactory.getLogger(ForecastNarrativeService.class);
    private static final int MAX_OUTPUT_TOKENS = 300;
    private static final int MAX_ALERTS_IN_PROMPT = 5;

    private final NarrativeEnrichmentClient client;
    private final ExecutorService executor;
    private final long timeoutMs;

    public ForecastNarrativeService(
            NarrativeEnrichmentClient client,
            @Qualifier("narrativeExecutor") ExecutorService executor,
            LiquiplanProperties properties
    ) {
        this.client = client;
        this.executor = executor;
        this.timeoutMs = properties.ai().timeoutOrDefault();
    }

    public Optional<String> narrate(LiquidityForecast forecast) {
        if (!client.hasCredentials()) {
            log.debug("Narrative enrichment requested but no API key configured");
            return Optional.empty();
        }
        List<NarrativeEnrichmentClient.Message> prompt = List.of(
                new NarrativeEnrichmentClient.Message("system",
                        "You are a treasury analyst. Summarize the liquidity forecast for a managing director in at most four sentences. Use only the figures provided."),
                new NarrativeEnrichmentClient.Message("user", buildPrompt(forecast))
        );
        Future<Optional<String>> future;
        try {
            future = executor.submit(() -> client.generateText(prompt, MAX_OUTPUT_TOKENS));
        } catch (RejectedExecutionException ex) {
            log.warn("Narrative enrichment rejected: {}", ex.getMessage());
            return Optional.empty();
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Narrative enrichment timed out after {} ms", timeoutMs);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Narrative enrichment interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Narrative enrichment failed: {}", cause.getMessage());
        }
        return Optional.empty();
    }

    String buildPrompt(LiquidityForecast forecast) {
        LiquidityKpis kpis = forecast.kpis();
        StringBuilder sb = new StringBuilder();
        sb.append("Reference date: ").append(forecast.referenceDate()).append('\n');
        sb.append("Horizon: ").append(forecast.weeks().size()).append(" weeks\n");
        sb.append("Start balance: EUR ").append(Money.format(kpis.currentBalance())).append('\n');
        sb.append("Minimum balance: EUR ").append(Money.format(kpis.minBalance()))
                .append(" in CW ").append(kpis.minBalanceWeek()).append('\n');
        sb.append("Threshold: EUR ").append(Money.format(forecast.threshold())).append('\n');
        sb.append("Weekly burn rate: EUR ").append(Money.format(kpis.burnRate())).append('\n');
        sb.append("Runway: ")
                .append(kpis.runway().map(weeks -> weeks.toPlainString() + " weeks").orElse("not depleted within horizon"))
                .append('\n');
        List<LiquidityAlert> alerts = forecast.alerts();
        if (!alerts.isEmpty()) {
            sb.append("Alerts:\n");
            alerts.stream().limit(MAX_ALERTS_IN_PROMPT)
                    .forEach(alert -> sb.append("- ").append(alert.severity()).append(": ").append(alert.message()).append('\n'));
        }
        if (!forecast.insights().isEmpty()) {
            sb.append("Insights:\n");
            forecast.insights().forEach(insight -> sb.append("- ").append(insight).append('\n'));
        }
        return sb.toString();
    }
}
