package com.liquiplan.forecast.forecast;

import java.time.LocalDate;

/**
 * Inclusive day-of-month window, e.g. 25-28 for end-of-month payroll runs.
 */
public record DayWindow(int firstDay, int lastDay) {
    public DayWindow {
        if (firstDay < 1 || lastDay > 31 || firstDay > lastDay) {
            throw new IllegalArgumentException("day window must satisfy 1 <= firstDay <= lastDay <= 31");
        }
    }

    public boolean contains(LocalDate date) {
        int day = date.getDayOfMonth();
        return day >= firstDay && day <= lastDay;
    }
}
