package com.liquiplan.forecast.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record LiquidityForecast(
        LocalDate referenceDate,
        BigDecimal startBalance,
        BigDecimal threshold,
        List<LiquidityWeek> weeks,
        List<LiquidityAlert> alerts,
        LiquidityKpis kpis,
        List<String> insights,
        List<RecurringPattern> recurringPatterns,
        List<CategoryBreakdownItem> categoryBreakdown
) {
}
