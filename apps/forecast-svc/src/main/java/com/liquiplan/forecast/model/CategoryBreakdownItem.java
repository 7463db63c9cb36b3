package com.liquiplan.forecast.model;

import java.math.BigDecimal;

public record CategoryBreakdownItem(
        String name,
        BigDecimal totalAmount,
        CashflowDirection direction,
        BigDecimal weeklyAverage,
        BigDecimal percentage,
        String color
) {
}
