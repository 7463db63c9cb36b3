package com.liquiplan.forecast.model;

import java.math.BigDecimal;

public record RecurringPattern(
        String description,
        String counterparty,
        BigDecimal averageAmount,
        Frequency frequency,
        int typicalDayOfMonth,
        BigDecimal confidence,
        int occurrences,
        CashflowDirection direction,
        String category,
        int accountRangeStart,
        int accountRangeEnd
) {
    public boolean isMonthlyOutflowOf(String categoryName) {
        return frequency == Frequency.MONTHLY
                && direction == CashflowDirection.OUTFLOW
                && category.equals(categoryName);
    }

    /**
     * Amount weighted by detection confidence, as it enters a projected week.
     */
    public BigDecimal expectedAmount() {
        return averageAmount.multiply(confidence);
    }
}
