package com.liquiplan.forecast.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record LiquidityForecastResponseDto(
        LocalDate referenceDate,
        BigDecimal startBalance,
        BigDecimal threshold,
        List<Week> weeks,
        List<Alert> alerts,
        Kpis kpis,
        List<String> insights,
        List<Pattern> recurringPatterns,
        List<Category> categoryBreakdown,
        String narrative,
        String traceId
) {
    public record Week(
            int weekIndex,
            int calendarWeek,
            LocalDate startDate,
            LocalDate endDate,
            BigDecimal openingBalance,
            BigDecimal inflow,
            BigDecimal outflow,
            BigDecimal netCashflow,
            BigDecimal closingBalance,
            BigDecimal confidence,
            BigDecimal lowerBound,
            BigDecimal upperBound,
            List<WeekCategory> categories
    ) {}

    public record WeekCategory(
            String name,
            BigDecimal amount,
            String direction,
            boolean recurring,
            BigDecimal confidence,
            int accountRangeStart,
            int accountRangeEnd
    ) {}

    public record Alert(int calendarWeek, String severity, String message, BigDecimal projectedBalance) {}

    public record Kpis(
            BigDecimal currentBalance,
            BigDecimal minBalance,
            int minBalanceWeek,
            BigDecimal burnRate,
            BigDecimal runwayWeeks,
            boolean runwayUnbounded,
            BigDecimal averageWeeklyInflow,
            BigDecimal averageWeeklyOutflow,
            BigDecimal totalProjectedInflow,
            BigDecimal totalProjectedOutflow
    ) {}

    public record Pattern(
            String description,
            String counterparty,
            BigDecimal averageAmount,
            String frequency,
            int typicalDayOfMonth,
            BigDecimal confidence,
            int occurrences,
            String direction,
            String category
    ) {}

    public record Category(
            String name,
            BigDecimal totalAmount,
            String direction,
            BigDecimal weeklyAverage,
            BigDecimal percentage,
            String color
    ) {}
}
