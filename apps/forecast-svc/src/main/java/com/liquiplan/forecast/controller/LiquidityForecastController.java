package com.liquiplan.forecast.controller;

import com.liquiplan.forecast.controller.dto.LiquidityForecastRequestDto;
import com.liquiplan.forecast.controller.dto.LiquidityForecastResponseDto;
import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.LiquidityForecast;
import com.liquiplan.forecast.model.LiquidityKpis;
import com.liquiplan.forecast.security.RequestContextHolder;
import com.liquiplan.forecast.service.LiquidityForecastService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LiquidityForecastController {

    private final LiquidityForecastService forecastService;

    public LiquidityForecastController(LiquidityForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @PostMapping("/liquidity-forecast")
    public ResponseEntity<LiquidityForecastResponseDto> forecast(@Valid @RequestBody LiquidityForecastRequestDto request) {
        List<Booking> bookings = request.bookings().stream()
                .map(booking -> new Booking(
                        booking.postingDate(),
                        booking.amount(),
                        booking.account(),
                        booking.counterparty(),
                        booking.text()))
                .toList();
        LiquidityForecastService.ForecastOutcome outcome = forecastService.forecast(new LiquidityForecastService.ForecastRequest(
                bookings,
                request.startBalance(),
                request.threshold(),
                request.weeks(),
                request.now(),
                request.enrichNarrativeRequested()
        ));
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.ok(map(outcome.forecast(), outcome.narrative().orElse(null), traceId));
    }

    private LiquidityForecastResponseDto map(LiquidityForecast forecast, String narrative, String traceId) {
        LiquidityKpis kpis = forecast.kpis();
        return new LiquidityForecastResponseDto(
                forecast.referenceDate(),
                forecast.startBalance(),
                forecast.threshold(),
                forecast.weeks().stream()
                        .map(week -> new LiquidityForecastResponseDto.Week(
                                week.index(),
                                week.calendarWeek(),
                                week.startDate(),
                                week.endDate(),
                                week.openingBalance(),
                                week.inflow(),
                                week.outflow(),
                                week.netCashflow(),
                                week.closingBalance(),
                                week.confidence(),
                                week.lowerBound(),
                                week.upperBound(),
                                week.categories().stream()
                                        .map(category -> new LiquidityForecastResponseDto.WeekCategory(
                                                category.name(),
                                                category.amount(),
                                                lower(category.direction()),
                                                category.recurring(),
                                                category.confidence(),
                                                category.accountRangeStart(),
                                                category.accountRangeEnd()))
                                        .toList()))
                        .toList(),
                forecast.alerts().stream()
                        .map(alert -> new LiquidityForecastResponseDto.Alert(
                                alert.calendarWeek(), lower(alert.severity()), alert.message(), alert.projectedBalance()))
                        .toList(),
                new LiquidityForecastResponseDto.Kpis(
                        kpis.currentBalance(),
                        kpis.minBalance(),
                        kpis.minBalanceWeek(),
                        kpis.burnRate(),
                        kpis.runway().orElse(null),
                        kpis.runwayUnbounded(),
                        kpis.averageWeeklyInflow(),
                        kpis.averageWeeklyOutflow(),
                        kpis.totalProjectedInflow(),
                        kpis.totalProjectedOutflow()),
                forecast.insights(),
                forecast.recurringPatterns().stream()
                        .map(pattern -> new LiquidityForecastResponseDto.Pattern(
                                pattern.description(),
                                pattern.counterparty(),
                                pattern.averageAmount(),
                                lower(pattern.frequency()),
                                pattern.typicalDayOfMonth(),
                                pattern.confidence(),
                                pattern.occurrences(),
                                lower(pattern.direction()),
                                pattern.category()))
                        .toList(),
                forecast.categoryBreakdown().stream()
                        .map(item -> new LiquidityForecastResponseDto.Category(
                                item.name(),
                                item.totalAmount(),
                                lower(item.direction()),
                                item.weeklyAverage(),
                                item.percentage(),
                                item.color()))
                        .toList(),
                narrative,
                traceId
        );
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
