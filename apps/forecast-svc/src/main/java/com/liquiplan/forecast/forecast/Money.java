package com.liquiplan.forecast.forecast;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Currency helpers shared by the forecast engine. All surfaced amounts carry scale 2, HALF_UP.
 */
public final class Money {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal divideSafe(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) {
            return ZERO;
        }
        return numerator.divide(denominator, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentageOf(BigDecimal part, BigDecimal total) {
        return divideSafe(part.multiply(HUNDRED), total);
    }

    public static String format(BigDecimal amount) {
        return String.format(Locale.GERMANY, "%,.2f", round(amount));
    }
}
