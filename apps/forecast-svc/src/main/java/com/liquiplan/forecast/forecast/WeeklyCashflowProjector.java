package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.AccountCategory;
import com.liquiplan.forecast.model.Booking;
import com.liquiplan.forecast.model.CashflowCategory;
import com.liquiplan.forecast.model.CashflowDirection;
import com.liquiplan.forecast.model.CategoryBreakdownItem;
import com.liquiplan.forecast.model.LiquidityAlert;
import com.liquiplan.forecast.model.LiquidityForecast;
import com.liquiplan.forecast.model.LiquidityKpis;
import com.liquiplan.forecast.model.LiquidityWeek;
import com.liquiplan.forecast.model.RecurringPattern;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Week-by-week liquidity simulation. Deterministic extrapolation from the ledger: a trailing baseline,
 * detected recurring payments, calendar overlays for payroll and rent, and a variance band that widens
 * with distance. The reference date always comes from {@link ForecastParameters#now()}.
 */
@Component
public class WeeklyCashflowProjector {

    private static final Logger log = LoggerFactory.getLogger(WeeklyCashflowProjector.class);

    private final AccountCategorizer categorizer;
    private final RecurringPatternDetector patternDetector;
    private final HistoricalVarianceEstimator varianceEstimator;
    private final AlertGenerator alertGenerator;
    private final InsightNarrator insightNarrator;
    private final CategoryBreakdownAggregator breakdownAggregator;
    private final ForecastSettings settings;

    public WeeklyCashflowProjector(
            AccountCategorizer categorizer,
            RecurringPatternDetector patternDetector,
            HistoricalVarianceEstimator varianceEstimator,
            AlertGenerator alertGenerator,
            InsightNarrator insightNarrator,
            CategoryBreakdownAggregator breakdownAggregator,
            ForecastSettings settings
    ) {
        this.categorizer = categorizer;
        this.patternDetector = patternDetector;
        this.varianceEstimator = varianceEstimator;
        this.alertGenerator = alertGenerator;
        this.insightNarrator = insightNarrator;
        this.breakdownAggregator = breakdownAggregator;
        this.settings = settings;
    }

    public LiquidityForecast project(List<Booking> bookings, ForecastParameters parameters) {
        List<Booking> history = bookings == null ? List.of() : bookings;
        LocalDate now = parameters.now();
        List<RecurringPattern> patterns = patternDetector.detect(history, now);
        Baseline baseline = trailingBaseline(history, now);
        BigDecimal stdDev = varianceEstimator.estimate(history);

        List<LiquidityWeek> weeks = new ArrayList<>(parameters.weeks());
        BigDecimal openingBalance = parameters.startBalance();
        BigDecimal minBalance = openingBalance;
        int minBalanceWeek = WeekCalendar.calendarWeek(WeekCalendar.weekStart(now, 0));
        BigDecimal totalInflow = Money.ZERO;
        BigDecimal totalOutflow = Money.ZERO;

        for (int index = 0; index < parameters.weeks(); index++) {
            LocalDate weekStart = WeekCalendar.weekStart(now, index);
            LocalDate weekEnd = weekStart.plusDays(6);
            int calendarWeek = WeekCalendar.calendarWeek(weekStart);

            BigDecimal inflow = baseline.inflow();
            BigDecimal outflow = baseline.outflow().add(calendarOverlay(weekStart, patterns));
            List<RecurringPattern> duePatterns = patternsDueIn(index, patterns);
            for (RecurringPattern pattern : duePatterns) {
                if (pattern.direction() == CashflowDirection.INFLOW) {
                    inflow = inflow.add(pattern.expectedAmount());
                } else {
                    outflow = outflow.add(pattern.expectedAmount());
                }
            }
            inflow = Money.round(inflow);
            outflow = Money.round(outflow);

            BigDecimal netCashflow = inflow.subtract(outflow);
            BigDecimal closingBalance = openingBalance.add(netCashflow);
            BigDecimal halfWidth = stdDev.multiply(BigDecimal.ONE.add(settings.bandWideningPerWeek().multiply(BigDecimal.valueOf(index))));

            weeks.add(new LiquidityWeek(
                    index,
                    calendarWeek,
                    weekStart,
                    weekEnd,
                    openingBalance,
                    inflow,
                    outflow,
                    netCashflow,
                    closingBalance,
                    confidenceFor(index),
                    Money.round(closingBalance.subtract(halfWidth)),
                    Money.round(closingBalance.add(halfWidth)),
                    weekCategories(history, weekStart, weekEnd, patterns, duePatterns)
            ));

            if (closingBalance.compareTo(minBalance) < 0) {
                minBalance = closingBalance;
                minBalanceWeek = calendarWeek;
            }
            totalInflow = totalInflow.add(inflow);
            totalOutflow = totalOutflow.add(outflow);
            openingBalance = closingBalance;
        }

        BigDecimal burnRate = Money.divideSafe(totalOutflow.subtract(totalInflow), BigDecimal.valueOf(parameters.weeks()));
        // a projected balance below zero leaves no buffer, so the runway bottoms out at 0
        Optional<BigDecimal> runway = burnRate.signum() > 0
                ? Optional.of(minBalance.divide(burnRate, 2, RoundingMode.HALF_UP).max(Money.ZERO))
                : Optional.empty();
        LiquidityKpis kpis = new LiquidityKpis(
                parameters.startBalance(),
                Money.round(minBalance),
                minBalanceWeek,
                burnRate,
                runway,
                baseline.inflow(),
                baseline.outflow(),
                Money.round(totalInflow),
                Money.round(totalOutflow)
        );

        List<LiquidityWeek> projectedWeeks = List.copyOf(weeks);
        List<LiquidityAlert> alerts = alertGenerator.generate(projectedWeeks, parameters.threshold());
        List<CategoryBreakdownItem> categoryBreakdown = breakdownAggregator.aggregate(projectedWeeks);
        List<String> insights = insightNarrator.narrate(projectedWeeks, patterns, kpis, categoryBreakdown);

        log.debug("Projected {} weeks from {} bookings: patterns={}, stdDev={}, minBalance={}, alerts={}",
                projectedWeeks.size(), history.size(), patterns.size(), stdDev, kpis.minBalance(), alerts.size());

        return new LiquidityForecast(
                now,
                parameters.startBalance(),
                parameters.threshold(),
                projectedWeeks,
                List.copyOf(alerts),
                kpis,
                insights,
                patterns,
                categoryBreakdown
        );
    }

    private Baseline trailingBaseline(List<Booking> history, LocalDate now) {
        LocalDate windowStart = now.minusDays(settings.trailingWindowDays());
        BigDecimal inflow = BigDecimal.ZERO;
        BigDecimal outflow = BigDecimal.ZERO;
        for (Booking booking : history) {
            if (booking.postingDate().isBefore(windowStart)) {
                continue;
            }
            if (categorizer.directionOf(booking) == CashflowDirection.INFLOW) {
                inflow = inflow.add(booking.amount().abs());
            } else {
                outflow = outflow.add(booking.amount().abs());
            }
        }
        return new Baseline(
                Money.divideSafe(inflow, settings.trailingWindowWeeks()),
                Money.divideSafe(outflow, settings.trailingWindowWeeks()));
    }

    private BigDecimal confidenceFor(int index) {
        BigDecimal decayed = BigDecimal.ONE.subtract(settings.confidenceDecayPerWeek().multiply(BigDecimal.valueOf(index)));
        return decayed.max(settings.confidenceFloor()).setScale(2, RoundingMode.HALF_UP);
    }

    // end-of-month payroll and start-of-month rent land on top of the regular cadence
    private BigDecimal calendarOverlay(LocalDate weekStart, List<RecurringPattern> patterns) {
        BigDecimal overlay = BigDecimal.ZERO;
        if (settings.payrollWindow().contains(weekStart)) {
            overlay = overlay.add(overlayFor(patterns, settings.payrollCategory()));
        }
        if (settings.rentWindow().contains(weekStart)) {
            overlay = overlay.add(overlayFor(patterns, settings.rentCategory()));
        }
        return overlay;
    }

    private BigDecimal overlayFor(List<RecurringPattern> patterns, String category) {
        return patterns.stream()
                .filter(pattern -> pattern.isMonthlyOutflowOf(category))
                .map(pattern -> pattern.expectedAmount().multiply(settings.overlayFactor()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private List<RecurringPattern> patternsDueIn(int index, List<RecurringPattern> patterns) {
        return patterns.stream()
                .filter(pattern -> settings.band(pattern.frequency()).dueInWeek(index))
                .toList();
    }

    private List<CashflowCategory> weekCategories(
            List<Booking> history,
            LocalDate weekStart,
            LocalDate weekEnd,
            List<RecurringPattern> patterns,
            List<RecurringPattern> duePatterns
    ) {
        // a refund on an expense account is a separate inflow entry of the same category
        Map<CategoryKey, CategoryAccumulator> byCategory = new LinkedHashMap<>();
        for (Booking booking : history) {
            LocalDate date = booking.postingDate();
            if (date.isBefore(weekStart) || date.isAfter(weekEnd)) {
                continue;
            }
            AccountCategory category = categorizer.categorize(booking.account());
            CashflowDirection direction = categorizer.directionOf(booking);
            CategoryAccumulator accumulator = byCategory.computeIfAbsent(new CategoryKey(category.name(), direction),
                    key -> new CategoryAccumulator(key.name(), key.direction(), booking.account(), booking.account()));
            accumulator.add(booking.amount().abs());
            accumulator.widenRange(booking.account());
            String normalized = RecurringPatternDetector.normalizeDescription(booking.text());
            patterns.stream()
                    .filter(pattern -> pattern.direction() == direction
                            && pattern.category().equals(category.name())
                            && pattern.description().equals(normalized))
                    .findFirst()
                    .ifPresent(pattern -> accumulator.markRecurring(pattern.confidence()));
        }

        for (RecurringPattern pattern : duePatterns) {
            CategoryAccumulator accumulator = byCategory.computeIfAbsent(new CategoryKey(pattern.category(), pattern.direction()),
                    key -> new CategoryAccumulator(key.name(), key.direction(), pattern.accountRangeStart(), pattern.accountRangeEnd()));
            accumulator.add(pattern.expectedAmount());
            accumulator.markRecurring(pattern.confidence());
        }

        return byCategory.values().stream().map(CategoryAccumulator::toCategory).toList();
    }

    private record Baseline(BigDecimal inflow, BigDecimal outflow) {
    }

    private record CategoryKey(String name, CashflowDirection direction) {
    }

    private static final class CategoryAccumulator {
        private final String name;
        private final CashflowDirection direction;
        private BigDecimal amount = BigDecimal.ZERO;
        private boolean recurring;
        private BigDecimal confidence = Money.ZERO;
        private int rangeStart;
        private int rangeEnd;

        private CategoryAccumulator(String name, CashflowDirection direction, int rangeStart, int rangeEnd) {
            this.name = name;
            this.direction = direction;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
        }

        private void add(BigDecimal value) {
            amount = amount.add(value);
        }

        private void widenRange(int account) {
            rangeStart = Math.min(rangeStart, account);
            rangeEnd = Math.max(rangeEnd, account);
        }

        private void markRecurring(BigDecimal patternConfidence) {
            recurring = true;
            confidence = confidence.max(patternConfidence);
        }

        private CashflowCategory toCategory() {
            return new CashflowCategory(name, Money.round(amount), direction, recurring, confidence, rangeStart, rangeEnd);
        }
    }
}
