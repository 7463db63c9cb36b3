package com.liquiplan.forecast.forecast;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

final class WeekCalendar {

    private WeekCalendar() {
    }

    static LocalDate weekStart(LocalDate referenceDate, int weekIndex) {
        return referenceDate.plusWeeks(weekIndex).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    static int calendarWeek(LocalDate date) {
        return date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    static int weekBasedYear(LocalDate date) {
        return date.get(IsoFields.WEEK_BASED_YEAR);
    }
}
