package com.liquiplan.forecast.service;

import com.liquiplan.forecast.ai.ForecastNarrativeService;
import com.liquiplan.forecast.forecast.ForecastParameters;
import com.liquiplan.forecast.forecast.ForecastSettings;
import com.liquiplan.forecast.forecast.WeeklyCashflowProjector;
import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.LiquidityForecast;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LiquidityForecastService {

    private static final Logger log = LoggerFactory.getLogger(LiquidityForecastService.class);

    private final WeeklyCashflowProjector projector;
    private final ForecastNarrativeService narrativeService;
    private final ForecastSettings settings;
    private final Clock clock;

    public LiquidityForecastService(
            WeeklyCashflowProjector projector,
            ForecastNarrativeService narrativeService,
            ForecastSettings settings,
            Clock clock
    ) {
        this.projector = projector;
        this.narrativeService = narrativeService;
        this.settings = settings;
        this.clock = clock;
    }

    public ForecastOutcome forecast(ForecastRequest request) {
        LocalDate now = request.now() != null ? request.now() : LocalDate.now(clock);
        ForecastParameters parameters = ForecastParameters.withDefaults(
                request.startBalance(), request.threshold(), request.weeks(), now, settings);
        LiquidityForecast forecast = projector.project(request.bookings(), parameters);
        Optional<String> narrative = request.enrichNarrative()
                ? narrativeService.narrate(forecast)
                : Optional.empty();
        log.info("Forecast computed: bookings={} weeks={} now={} minBalance={} alerts={} narrative={}",
                request.bookings().size(), parameters.weeks(), now, forecast.kpis().minBalance(),
                forecast.alerts().size(), narrative.isPresent());
        return new ForecastOutcome(forecast, narrative);
    }

    public record ForecastRequest(
            List<Booking> bookings,
            BigDecimal startBalance,
            BigDecimal threshold,
            Integer weeks,
            LocalDate now,
            boolean enrichNarrative
    ) {
        public ForecastRequest {
            bookings = bookings == null ? List.of() : List.copyOf(bookings);
        }
    }

    public record ForecastOutcome(LiquidityForecast forecast, Optional<String> narrative) {
    }
}
