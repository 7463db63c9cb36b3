package com.liquiplan.forecast.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Headline figures of a forecast run. An empty {@code runway} means no depletion is projected.
 */
public record LiquidityKpis(
        BigDecimal currentBalance,
        BigDecimal minBalance,
        int minBalanceWeek,
        BigDecimal burnRate,
        Optional<BigDecimal> runway,
        BigDecimal averageWeeklyInflow,
        BigDecimal averageWeeklyOutflow,
        BigDecimal totalProjectedInflow,
        BigDecimal totalProjectedOutflow
) {
    public boolean runwayUnbounded() {
        return runway.isEmpty();
    }
}
