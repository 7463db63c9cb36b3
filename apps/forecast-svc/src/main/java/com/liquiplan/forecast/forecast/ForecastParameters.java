package com.liquiplan.forecast.forecast;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Validated inputs of a single forecast run. {@code now} is the reference date the horizon starts from.
 */
public record ForecastParameters(BigDecimal startBalance, BigDecimal threshold, int weeks, LocalDate now) {

    public ForecastParameters {
        if (startBalance == null) {
            throw new IllegalArgumentException("startBalance must be provided");
        }
        if (threshold == null || threshold.signum() <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (weeks <= 0) {
            throw new IllegalArgumentException("weeks must be positive");
        }
        if (now == null) {
            throw new IllegalArgumentException("now must be provided");
        }
        startBalance = startBalance.setScale(2, RoundingMode.HALF_UP);
        threshold = threshold.setScale(2, RoundingMode.HALF_UP);
    }

    public static ForecastParameters withDefaults(
            BigDecimal startBalance,
            BigDecimal threshold,
            Integer weeks,
            LocalDate now,
            ForecastSettings settings
    ) {
        return new ForecastParameters(
                startBalance,
                threshold != null ? threshold : settings.defaultThreshold(),
                weeks != null ? weeks : settings.defaultWeeks(),
                now
        );
    }
}
