package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.CashflowDirection;
import com.liquiplan.forecast.model.CategoryBreakdownItem;
import com.liquiplan.forecast.model.LiquidityKpis;
import com.liquiplan.forecast.model.LiquidityWeek;
import com.liquiplan.forecast.model.RecurringPattern;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Fixed pipeline of observations over a finished projection. Order is stable so identical
 * forecasts always read the same.
 */
@Component
public class InsightNarrator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ForecastSettings settings;

    public InsightNarrator(ForecastSettings settings) {
        this.settings = settings;
    }

    public List<String> narrate(
            List<LiquidityWeek> weeks,
            List<RecurringPattern> patterns,
            LiquidityKpis kpis,
            List<CategoryBreakdownItem> categoryBreakdown
    ) {
        List<String> insights = new ArrayList<>();
        if (weeks.isEmpty()) {
            return insights;
        }
        payrollImpact(weeks, patterns).ifPresent(insights::add);
        insights.add(runwayStatement(weeks.size(), kpis));
        primaryCostDriver(categoryBreakdown).ifPresent(insights::add);
        balanceTrend(weeks).ifPresent(insights::add);
        insights.add(outflowRatio(kpis));
        return insights.size() > settings.maxInsights()
                ? List.copyOf(insights.subList(0, settings.maxInsights()))
                : List.copyOf(insights);
    }

    private Optional<String> payrollImpact(List<LiquidityWeek> weeks, List<RecurringPattern> patterns) {
        Optional<RecurringPattern> payroll = patterns.stream()
                .filter(pattern -> pattern.isMonthlyOutflowOf(settings.payrollCategory()))
                .findFirst();
        if (payroll.isEmpty()) {
            return Optional.empty();
        }
        LocalDate paymentDate = nextOccurrence(weeks.get(0).startDate(), payroll.get().typicalDayOfMonth());
        return weeks.stream()
                .filter(week -> !paymentDate.isBefore(week.startDate()) && !paymentDate.isAfter(week.endDate()))
                .findFirst()
                .map(week -> "Payroll run in CW " + week.calendarWeek()
                        + " is expected to leave a balance of EUR " + Money.format(week.closingBalance()));
    }

    private String runwayStatement(int horizonWeeks, LiquidityKpis kpis) {
        Optional<BigDecimal> shortRunway = kpis.runway()
                .filter(runway -> runway.compareTo(BigDecimal.valueOf(horizonWeeks)) < 0);
        if (shortRunway.isPresent()) {
            return "At the current burn rate the liquidity buffer lasts "
                    + shortRunway.get().setScale(1, RoundingMode.HALF_UP).toPlainString() + " weeks";
        }
        return "Liquidity position is stable across the " + horizonWeeks + "-week horizon";
    }

    private Optional<String> primaryCostDriver(List<CategoryBreakdownItem> categoryBreakdown) {
        return categoryBreakdown.stream()
                .filter(item -> item.direction() == CashflowDirection.OUTFLOW)
                .filter(item -> item.totalAmount().signum() > 0)
                .max(Comparator.comparing(CategoryBreakdownItem::totalAmount))
                .map(item -> "Primary cost driver: " + item.name() + " ("
                        + item.percentage().setScale(0, RoundingMode.HALF_UP).toPlainString() + "% of outflows)");
    }

    private Optional<String> balanceTrend(List<LiquidityWeek> weeks) {
        int split = (weeks.size() + 1) / 2;
        List<LiquidityWeek> firstHalf = weeks.subList(0, split);
        List<LiquidityWeek> secondHalf = weeks.subList(split, weeks.size());
        if (secondHalf.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal firstAverage = averageClosing(firstHalf);
        BigDecimal secondAverage = averageClosing(secondHalf);
        int comparison = firstAverage.compareTo(secondAverage);
        if (comparison > 0) {
            return Optional.of("Trend: balance declines in the second half of the horizon - average decrease EUR "
                    + Money.format(firstAverage.subtract(secondAverage)));
        }
        if (comparison < 0) {
            return Optional.of("Trend: balance recovers in the second half of the horizon - average improvement EUR "
                    + Money.format(secondAverage.subtract(firstAverage)));
        }
        return Optional.empty();
    }

    private String outflowRatio(LiquidityKpis kpis) {
        BigDecimal inflow = kpis.totalProjectedInflow();
        BigDecimal outflow = kpis.totalProjectedOutflow();
        BigDecimal ratio;
        if (inflow.signum() > 0) {
            ratio = outflow.multiply(HUNDRED).divide(inflow, 0, RoundingMode.HALF_UP);
        } else {
            ratio = outflow.signum() > 0 ? HUNDRED : BigDecimal.ZERO;
        }
        return "Outflow ratio: projected outflows amount to " + ratio.toPlainString() + "% of expected inflows";
    }

    private static BigDecimal averageClosing(List<LiquidityWeek> weeks) {
        BigDecimal sum = weeks.stream()
                .map(LiquidityWeek::closingBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Money.divideSafe(sum, BigDecimal.valueOf(weeks.size()));
    }

    static LocalDate nextOccurrence(LocalDate from, int dayOfMonth) {
        YearMonth month = YearMonth.from(from);
        LocalDate candidate = month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
        if (candidate.isBefore(from)) {
            YearMonth next = month.plusMonths(1);
            candidate = next.atDay(Math.min(dayOfMonth, next.lengthOfMonth()));
        }
        return candidate;
    }
}
