package com.liquiplan.forecast.model;

import java.math.BigDecimal;

/**
 * One category's contribution to a single projected week.
 */
public record CashflowCategory(
        String name,
        BigDecimal amount,
        CashflowDirection direction,
        boolean recurring,
        BigDecimal confidence,
        int accountRangeStart,
        int accountRangeEnd
) {
}
