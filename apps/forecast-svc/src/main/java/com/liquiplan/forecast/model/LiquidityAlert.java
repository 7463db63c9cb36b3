package com.liquiplan.forecast.model;

import java.math.BigDecimal;

public record LiquidityAlert(
        int calendarWeek,
        Severity severity,
        String message,
        BigDecimal projectedBalance
) {
    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }
}
