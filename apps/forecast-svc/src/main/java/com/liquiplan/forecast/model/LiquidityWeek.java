package com.liquiplan.forecast.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record LiquidityWeek(
        int index,
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
        List<CashflowCategory> categories
) {
}
