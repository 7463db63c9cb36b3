package com.liquiplan.forecast.forecast;

import com.liquiplan.forecast.model.Frequency;

/**
 * Maps an annualized occurrence rate onto a frequency class.
 *
 * @param minPerYear          inclusive lower rate bound
 * @param maxPerYearExclusive exclusive upper rate bound, {@link Double#POSITIVE_INFINITY} when open
 * @param nominalPerYear      rate at which the detection confidence reaches 1.0
 * @param cadenceWeeks        a pattern lands in every week whose index is a multiple of this value
 */
public record FrequencyBand(
        Frequency frequency,
        double minPerYear,
        double maxPerYearExclusive,
        double nominalPerYear,
        int cadenceWeeks
) {
    public FrequencyBand {
        if (frequency == null) {
            throw new IllegalArgumentException("frequency must be provided");
        }
        if (!(minPerYear < maxPerYearExclusive)) {
            throw new IllegalArgumentException("minPerYear must be below maxPerYearExclusive for " + frequency);
        }
        if (nominalPerYear <= 0) {
            throw new IllegalArgumentException("nominalPerYear must be positive for " + frequency);
        }
        if (cadenceWeeks <= 0) {
            throw new IllegalArgumentException("cadenceWeeks must be positive for " + frequency);
        }
    }

    public boolean matches(double annualRate) {
        return annualRate >= minPerYear && annualRate < maxPerYearExclusive;
    }

    public boolean dueInWeek(int weekIndex) {
        return weekIndex % cadenceWeeks == 0;
    }
}
