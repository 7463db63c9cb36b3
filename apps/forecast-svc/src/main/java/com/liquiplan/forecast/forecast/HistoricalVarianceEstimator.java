package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.CashflowDirection;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HistoricalVarianceEstimator {

    private static final Logger log = LoggerFactory.getLogger(HistoricalVarianceEstimator.class);

    private final AccountCategorizer categorizer;
    private final ForecastSettings settings;

    public HistoricalVarianceEstimator(AccountCategorizer categorizer, ForecastSettings settings) {
        this.categorizer = categorizer;
        this.settings = settings;
    }

    /**
     * Population standard deviation of the weekly net cashflow (ISO weeks) found in the history.
     */
    public BigDecimal estimate(List<Booking> bookings) {
        if (bookings == null || bookings.isEmpty()) {
            return Money.round(settings.fallbackStdDev());
        }
        Map<IsoWeek, BigDecimal> netByWeek = new LinkedHashMap<>();
        for (Booking booking : bookings) {
            IsoWeek week = new IsoWeek(
                    WeekCalendar.weekBasedYear(booking.postingDate()),
                    WeekCalendar.calendarWeek(booking.postingDate()));
            BigDecimal magnitude = booking.amount().abs();
            BigDecimal signed = categorizer.directionOf(booking) == CashflowDirection.INFLOW ? magnitude : magnitude.negate();
            netByWeek.merge(week, signed, BigDecimal::add);
        }

        double[] series = netByWeek.values().stream().mapToDouble(BigDecimal::doubleValue).toArray();
        double mean = 0d;
        for (double value : series) {
            mean += value;
        }
        mean /= series.length;
        double variance = 0d;
        for (double value : series) {
            variance += Math.pow(value - mean, 2);
        }
        variance /= series.length;
        double stdDev = Math.sqrt(variance);
        if (!Double.isFinite(stdDev)) {
            log.debug("Weekly net cashflow variance not finite over {} weeks; using fallback", series.length);
            return Money.round(settings.fallbackStdDev());
        }
        return BigDecimal.valueOf(stdDev).setScale(2, RoundingMode.HALF_UP);
    }

    private record IsoWeek(int weekBasedYear, int week) {
    }
}
